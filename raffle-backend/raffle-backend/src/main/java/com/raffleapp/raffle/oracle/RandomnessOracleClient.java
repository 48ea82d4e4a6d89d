package com.raffleapp.raffle.oracle;

/**
 * Client side of the external randomness oracle.
 * <p>
 * An accepted request is answered exactly once, asynchronously, by a call to
 * {@code WinnerResolverService.fulfill} carrying the returned request id.
 */
public interface RandomnessOracleClient {

    /**
     * Submits a randomness request.
     *
     * @return the oracle's request id, used to correlate the fulfillment
     * @throws RuntimeException when the oracle does not accept the request
     */
    String submitRequest(OracleRequest request);

    record OracleRequest(
            String gasLane,
            long subscriptionId,
            int requestConfirmations,
            long callbackGasLimit,
            int numWords
    ) {}
}
