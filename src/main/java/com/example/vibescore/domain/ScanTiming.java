package com.example.vibescore.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Summary of timing information for a scan run.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ScanTiming {
    private List<StepTiming> steps;
    private double totalDurationSeconds;
}
