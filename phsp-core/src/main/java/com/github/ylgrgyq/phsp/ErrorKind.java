package com.github.ylgrgyq.phsp;

/**
 * Kinds of format errors found while decoding a phase-space file.
 */
public enum ErrorKind {
    /**
     * The first 5 bytes of a file match neither "MODE0" nor "MODE2".
     */
    UnrecognizedTag,
    /**
     * Fewer bytes are available than a fixed-size region requires.
     */
    Truncated,
    /**
     * The file holds fewer decodable records than its header declares.
     */
    RecordCountMismatch
}
