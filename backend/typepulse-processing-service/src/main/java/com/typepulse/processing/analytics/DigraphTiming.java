package com.typepulse.processing.analytics;

/** @param avgTime mean transition time in ms, rounded */
public record DigraphTiming(String digraph, long avgTime, int count) {}
