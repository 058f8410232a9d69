package com.typepulse.processing.analytics;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record ErrorProfile(
        int errorCount,
        Map<ErrorType, Integer> errorsByType,
        Set<String> errorKeys,
        Integer errorBurstCount,
        List<String> slowestWords
) {}
