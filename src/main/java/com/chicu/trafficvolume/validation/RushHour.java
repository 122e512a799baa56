package com.chicu.trafficvolume.validation;

public final class RushHour {

    private RushHour() {}

    /** 1 for 07-09 and 16-18 inclusive, otherwise 0. */
    public static int flagFor(int hour) {
        return (hour >= 7 && hour <= 9) || (hour >= 16 && hour <= 18) ? 1 : 0;
    }
}
