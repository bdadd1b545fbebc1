package com.marketlevels.common.volatility;

/**
 * Result of an expected-move computation: a displayable band
 * ({@link ExpectedMoveResult}) or an explicit "too small to display"
 * ({@link ExpectedMoveTooSmall}).
 */
public sealed interface ExpectedMoveOutcome permits ExpectedMoveResult, ExpectedMoveTooSmall {

    String symbol();

    boolean isDisplayable();
}
