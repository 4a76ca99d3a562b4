package com.carescore.model.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A recorded goal measurement and the progress it produced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressObservation {

    private Instant timestamp;

    private double measuredValue;

    private double progress;
}
