package com.gdin.inspection.gsw.toon;

import lombok.Getter;

@Getter
public class ToonFormatException extends IllegalArgumentException {

    private final int line;

    public ToonFormatException(int line, String message) {
        super("line " + line + ": " + message);
        this.line = line;
    }
}
