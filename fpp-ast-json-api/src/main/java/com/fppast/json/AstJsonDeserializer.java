package com.fppast.json;

import com.fppast.TranslationSession;
import com.fppast.ast.TransUnit;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for rebuilding typed FPP AST nodes from fpp-to-json output.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes the AST document produced by fpp-to-json.
     *
     * @param json the JSON text: an array of translation units
     * @param session the session supplying locations and fresh ids
     * @return the translation units, in input order
     * @throws AstJsonException if the text is not JSON
     * @throws com.fppast.FppAstException if the JSON does not describe an FPP AST
     */
    List<TransUnit> deserializeTransUnits(String json, TranslationSession session);

    /**
     * Reads and deserializes an AST document from a file.
     *
     * @throws IOException if the file cannot be read
     */
    List<TransUnit> deserializeTransUnits(Path file, TranslationSession session) throws IOException;
}
