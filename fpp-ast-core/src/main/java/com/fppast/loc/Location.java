package com.fppast.loc;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Source position of an AST node.
 *
 * @param file the source file
 * @param pos the encoded position within the file, as emitted by the producer
 * @param includingLoc the location of the include directive that pulled the file in, if any
 */
public record Location(Path file, String pos, Optional<String> includingLoc) {

    public Location {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(pos, "pos");
        Objects.requireNonNull(includingLoc, "includingLoc");
    }

    public Location(Path file, String pos) {
        this(file, pos, Optional.empty());
    }

    @Override
    public String toString() {
        return includingLoc
            .map(inc -> file + ": " + pos + " (included at " + inc + ")")
            .orElseGet(() -> file + ": " + pos);
    }
}
