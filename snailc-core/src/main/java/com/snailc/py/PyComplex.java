package com.snailc.py;

/**
 * An imaginary constant such as {@code 2j}.
 */
public record PyComplex(double imag) {
}
