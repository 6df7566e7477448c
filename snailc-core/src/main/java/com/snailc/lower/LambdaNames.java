package com.snailc.lower;

/**
 * Numbers hoisted lambdas within one compilation. The first name handed out is {@code __snail_lambda_1}.
 */
public final class LambdaNames {
    private int count;

    public String next() {
        count++;
        return RuntimeNames.LAMBDA_PREFIX + count;
    }

    public int issued() {
        return count;
    }
}
