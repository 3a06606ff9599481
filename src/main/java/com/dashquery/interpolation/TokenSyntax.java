package com.dashquery.interpolation;

/**
 * Source syntax a variable token was written in.
 */
public enum TokenSyntax {
    NONE,
    BARE,
    BRACED,
    BRACKETED
}
