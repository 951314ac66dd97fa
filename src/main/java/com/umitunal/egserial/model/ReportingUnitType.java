package com.umitunal.egserial.model;

/**
 * Kind of geopolitical unit a contest is reported for.
 */
public enum ReportingUnitType implements WireEnum {
    UNKNOWN("unknown"),
    BALLOT_BATCH("ballot_batch"),
    BALLOT_STYLE_AREA("ballot_style_area"),
    BOROUGH("borough"),
    CITY("city"),
    CITY_COUNCIL("city_council"),
    COMBINED_PRECINCT("combined_precinct"),
    CONGRESSIONAL("congressional"),
    COUNTRY("country"),
    COUNTY("county"),
    COUNTY_COUNCIL("county_council"),
    DROP_BOX("drop_box"),
    JUDICIAL("judicial"),
    MUNICIPALITY("municipality"),
    POLLING_PLACE("polling_place"),
    PRECINCT("precinct"),
    SCHOOL("school"),
    SPECIAL("special"),
    SPLIT_PRECINCT("split_precinct"),
    STATE("state"),
    STATE_HOUSE("state_house"),
    STATE_SENATE("state_senate"),
    TOWNSHIP("township"),
    UTILITY("utility"),
    VILLAGE("village"),
    VOTE_CENTER("vote_center"),
    WARD("ward"),
    WATER("water"),
    OTHER("other");

    private final String wireValue;

    ReportingUnitType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
