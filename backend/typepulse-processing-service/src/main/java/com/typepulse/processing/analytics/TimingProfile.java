package com.typepulse.processing.analytics;

public record TimingProfile(
        Double avgDwellTime,
        Double avgFlightTime,
        Double stdDevFlightTime,
        Double consistency,
        Integer consistencyRating,
        Integer typingRhythm
) {}
