package com.virtualsol.discovery.support;

/**
 * Well-formed mint addresses for tests.
 */
public final class TestMints {

    public static final String TOKEN_A = "7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr";
    public static final String TOKEN_B = "4k3Dyjzvzp8eMZWUXbBCjEvwSkkk59S5iCNLY3QrkX6R";
    public static final String TOKEN_C = "DezXAZ8z7PnrnRJjz3wXBoRgixCa6xjnB7YaB1pPB263";
    public static final String SOL = "So11111111111111111111111111111111111111112";
    public static final String USDC = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    private TestMints() {
    }
}
