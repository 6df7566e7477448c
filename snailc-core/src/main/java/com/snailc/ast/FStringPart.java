package com.snailc.ast;

/**
 * One segment of a template body: literal text or an interpolation.
 */
public sealed interface FStringPart permits TextPart, InterpolationPart {
}
