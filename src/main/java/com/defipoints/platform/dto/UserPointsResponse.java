package com.defipoints.platform.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Points of a user in the epoch in force plus lifetime totals, as decimal points.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPointsResponse {
    private String userId;
    private long epochNumber;
    private double depositPoints;
    private double borrowPoints;
    private double lpPoints;
    private double votingPowerPoints;
    private double dailyBonusPoints;
    private double manualPoints;
    private double totalPoints;
    private double totalPointsWithMultiplier;
    private long combinedMultiplierBps;
    private double lifetimePoints;
    private double lifetimePointsWithMultiplier;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant retrievedAt;
}
