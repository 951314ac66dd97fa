package com.umitunal.egserial.model;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Election record shaped values used across serialization tests.
 */
public final class ElectionRecordFixtures {

    private ElectionRecordFixtures() {
    }

    public static ElectionContext sampleContext() {
        ElectionContext context = new ElectionContext();
        context.setNumberOfGuardians(5);
        context.setQuorum(3);
        context.setElgamalPublicKey(ElementModP.of(new BigInteger("9C2A55B1F0E4D3", 16)));
        context.setCommitmentHash(ElementModQ.of(new BigInteger("1F2E3D4C5B6A7980", 16)));
        context.setManifestHash(ElementModQ.of(42));
        context.setCryptoBaseHash(new BigInteger("123456789ABCDEF0123456789", 16));
        context.setElectionType(ElectionType.GENERAL);
        context.setSpecVersion(SpecVersion.EG1_0);
        context.setCreatedAt(OffsetDateTime.of(2021, 3, 1, 8, 0, 0, 0, ZoneOffset.ofHours(-5)));
        Map<String, String> extendedData = new LinkedHashMap<>();
        extendedData.put("county", "Franklin");
        extendedData.put("state", "OH");
        context.setExtendedData(extendedData);
        return context;
    }

    public static GuardianRecord sampleGuardian(String guardianId, int sequenceOrder) {
        GuardianRecord guardian = new GuardianRecord();
        guardian.setGuardianId(guardianId);
        guardian.setSequenceOrder(sequenceOrder);
        guardian.setElectionPublicKey(ElementModP.of(1000L + sequenceOrder));
        List<ElementModP> commitments = new ArrayList<>();
        commitments.add(ElementModP.of(11L * sequenceOrder));
        commitments.add(ElementModP.of(13L * sequenceOrder));
        guardian.setCoefficientCommitments(commitments);
        guardian.setProofUsage(ProofUsage.SECRET_VALUE);
        return guardian;
    }

    public static SubmittedBallot sampleBallot(String objectId, BallotBoxState state) {
        SubmittedBallot ballot = new SubmittedBallot();
        ballot.setObjectId(objectId);
        ballot.setState(state);
        ballot.setTimestamp(OffsetDateTime.of(2021, 11, 2, 19, 30, 15, 0, ZoneOffset.UTC));
        List<ContestErrorType> errors = new ArrayList<>();
        errors.add(ContestErrorType.OVER_VOTE);
        ballot.setContestErrors(errors);
        return ballot;
    }

    public static class ElectionContext {
        private int numberOfGuardians;
        private int quorum;
        private ElementModP elgamalPublicKey;
        private ElementModQ commitmentHash;
        private ElementModQ manifestHash;
        private BigInteger cryptoBaseHash;
        private ElectionType electionType;
        private SpecVersion specVersion;
        private OffsetDateTime createdAt;
        private Map<String, String> extendedData;

        public ElectionContext() {}

        public int getNumberOfGuardians() { return numberOfGuardians; }
        public void setNumberOfGuardians(int numberOfGuardians) { this.numberOfGuardians = numberOfGuardians; }

        public int getQuorum() { return quorum; }
        public void setQuorum(int quorum) { this.quorum = quorum; }

        public ElementModP getElgamalPublicKey() { return elgamalPublicKey; }
        public void setElgamalPublicKey(ElementModP elgamalPublicKey) { this.elgamalPublicKey = elgamalPublicKey; }

        public ElementModQ getCommitmentHash() { return commitmentHash; }
        public void setCommitmentHash(ElementModQ commitmentHash) { this.commitmentHash = commitmentHash; }

        public ElementModQ getManifestHash() { return manifestHash; }
        public void setManifestHash(ElementModQ manifestHash) { this.manifestHash = manifestHash; }

        public BigInteger getCryptoBaseHash() { return cryptoBaseHash; }
        public void setCryptoBaseHash(BigInteger cryptoBaseHash) { this.cryptoBaseHash = cryptoBaseHash; }

        public ElectionType getElectionType() { return electionType; }
        public void setElectionType(ElectionType electionType) { this.electionType = electionType; }

        public SpecVersion getSpecVersion() { return specVersion; }
        public void setSpecVersion(SpecVersion specVersion) { this.specVersion = specVersion; }

        public OffsetDateTime getCreatedAt() { return createdAt; }
        public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

        public Map<String, String> getExtendedData() { return extendedData; }
        public void setExtendedData(Map<String, String> extendedData) { this.extendedData = extendedData; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ElectionContext)) return false;
            ElectionContext that = (ElectionContext) o;
            return numberOfGuardians == that.numberOfGuardians
                    && quorum == that.quorum
                    && Objects.equals(elgamalPublicKey, that.elgamalPublicKey)
                    && Objects.equals(commitmentHash, that.commitmentHash)
                    && Objects.equals(manifestHash, that.manifestHash)
                    && Objects.equals(cryptoBaseHash, that.cryptoBaseHash)
                    && electionType == that.electionType
                    && specVersion == that.specVersion
                    && Objects.equals(createdAt, that.createdAt)
                    && Objects.equals(extendedData, that.extendedData);
        }

        @Override
        public int hashCode() {
            return Objects.hash(numberOfGuardians, quorum, elgamalPublicKey, commitmentHash, manifestHash,
                    cryptoBaseHash, electionType, specVersion, createdAt, extendedData);
        }
    }

    public static class GuardianRecord {
        private String guardianId;
        private int sequenceOrder;
        private ElementModP electionPublicKey;
        private List<ElementModP> coefficientCommitments;
        private ProofUsage proofUsage;

        public GuardianRecord() {}

        public String getGuardianId() { return guardianId; }
        public void setGuardianId(String guardianId) { this.guardianId = guardianId; }

        public int getSequenceOrder() { return sequenceOrder; }
        public void setSequenceOrder(int sequenceOrder) { this.sequenceOrder = sequenceOrder; }

        public ElementModP getElectionPublicKey() { return electionPublicKey; }
        public void setElectionPublicKey(ElementModP electionPublicKey) { this.electionPublicKey = electionPublicKey; }

        public List<ElementModP> getCoefficientCommitments() { return coefficientCommitments; }
        public void setCoefficientCommitments(List<ElementModP> coefficientCommitments) {
            this.coefficientCommitments = coefficientCommitments;
        }

        public ProofUsage getProofUsage() { return proofUsage; }
        public void setProofUsage(ProofUsage proofUsage) { this.proofUsage = proofUsage; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof GuardianRecord)) return false;
            GuardianRecord that = (GuardianRecord) o;
            return sequenceOrder == that.sequenceOrder
                    && Objects.equals(guardianId, that.guardianId)
                    && Objects.equals(electionPublicKey, that.electionPublicKey)
                    && Objects.equals(coefficientCommitments, that.coefficientCommitments)
                    && proofUsage == that.proofUsage;
        }

        @Override
        public int hashCode() {
            return Objects.hash(guardianId, sequenceOrder, electionPublicKey, coefficientCommitments, proofUsage);
        }
    }

    public static class SubmittedBallot {
        private String objectId;
        private BallotBoxState state;
        private OffsetDateTime timestamp;
        private List<ContestErrorType> contestErrors;

        public SubmittedBallot() {}

        public String getObjectId() { return objectId; }
        public void setObjectId(String objectId) { this.objectId = objectId; }

        public BallotBoxState getState() { return state; }
        public void setState(BallotBoxState state) { this.state = state; }

        public OffsetDateTime getTimestamp() { return timestamp; }
        public void setTimestamp(OffsetDateTime timestamp) { this.timestamp = timestamp; }

        public List<ContestErrorType> getContestErrors() { return contestErrors; }
        public void setContestErrors(List<ContestErrorType> contestErrors) { this.contestErrors = contestErrors; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SubmittedBallot)) return false;
            SubmittedBallot that = (SubmittedBallot) o;
            return Objects.equals(objectId, that.objectId)
                    && state == that.state
                    && Objects.equals(timestamp, that.timestamp)
                    && Objects.equals(contestErrors, that.contestErrors);
        }

        @Override
        public int hashCode() {
            return Objects.hash(objectId, state, timestamp, contestErrors);
        }
    }
}
