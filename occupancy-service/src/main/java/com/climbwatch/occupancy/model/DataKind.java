package com.climbwatch.occupancy.model;

import java.util.Locale;

/**
 * The two kinds of branch data an ingestion cycle can target.
 */
public enum DataKind {

    /** Live occupancy snapshot; each cycle appends one reading per branch */
    OCCUPANCY,

    /** Hour-by-hour forecast; each cycle replaces the branch's full set */
    ATTENDANCE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
