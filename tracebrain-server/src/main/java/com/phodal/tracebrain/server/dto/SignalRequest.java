package com.phodal.tracebrain.server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flags a trace for human review.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignalRequest {

    private String reason;
}
