package com.snailc.ast;

public record TextPart(String text) implements FStringPart {
}
