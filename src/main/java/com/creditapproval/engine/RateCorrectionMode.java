package com.creditapproval.engine;

/**
 * What happens when the requested rate is below the floor of the customer's score band.
 */
public enum RateCorrectionMode {
    CORRECT,  // Raise the rate to the band floor and approve
    REJECT    // Reject, reporting the floor the customer would need
}
