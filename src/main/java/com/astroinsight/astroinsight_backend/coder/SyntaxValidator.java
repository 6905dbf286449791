package com.astroinsight.astroinsight_backend.coder;

/** Parse-only check of generated source. Must never execute the code. */
public interface SyntaxValidator {

    SyntaxCheck check(String code);

    record SyntaxCheck(boolean valid, String message) {
        public static SyntaxCheck ok()                    { return new SyntaxCheck(true, ""); }
        public static SyntaxCheck error(String message)   { return new SyntaxCheck(false, message); }
    }
}
