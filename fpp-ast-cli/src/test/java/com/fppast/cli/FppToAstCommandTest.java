package com.fppast.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FppToAstCommandTest {

    private static final String AST = """
        [
          {
            "members": [
              [
                [],
                {
                  "DefConstant": {
                    "node": {
                      "AstNode": {
                        "data": {
                          "name": "c",
                          "value": { "AstNode": { "data": { "ExprLiteralInt": { "value": "3" } }, "id": 4 } }
                        },
                        "id": 5
                      }
                    }
                  }
                },
                []
              ]
            ]
          }
        ]
        """;

    private static final String LOCATIONS = """
        { "5": { "file": "a.fpp", "pos": "1:1", "includingLoc": null } }
        """;

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = FppToAstCommand.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testPrintsDecodedMembersAsJson() throws Exception {
        Path ast = write("ast.json", AST);
        Path loc = write("loc.json", LOCATIONS);

        int exitCode = cmd.execute("-q", ast.toString(), loc.toString());

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("\"DefConstant\""));
        assertTrue(out.toString().contains("\"ExprLiteralInt\""));
    }

    @Test
    void testTextFormat() throws Exception {
        Path ast = write("ast.json", AST);
        Path loc = write("loc.json", LOCATIONS);

        int exitCode = cmd.execute("-q", "--format=text", "--parallel", ast.toString(), loc.toString());

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("DefConstant[name=c"));
    }

    @Test
    void testMissingAstFile() throws Exception {
        Path loc = write("loc.json", LOCATIONS);
        Path missing = dir.resolve("nope.json");

        int exitCode = cmd.execute("-q", missing.toString(), loc.toString());

        assertEquals(FppToAstCommand.EXIT_MISSING_INPUT, exitCode);
        assertTrue(err.toString().contains("error: File \"" + missing + "\" not found"));
    }

    @Test
    void testMissingLocationFile() throws Exception {
        Path ast = write("ast.json", AST);

        int exitCode = cmd.execute("-q", ast.toString(), dir.resolve("nope.json").toString());

        assertEquals(FppToAstCommand.EXIT_MISSING_INPUT, exitCode);
    }

    @Test
    void testInvalidTagFailsTranslation() throws Exception {
        Path ast = write("ast.json", AST.replace("DefConstant", "DefGadget"));
        Path loc = write("loc.json", LOCATIONS);

        int exitCode = cmd.execute("-q", ast.toString(), loc.toString());

        assertEquals(FppToAstCommand.EXIT_TRANSLATION_FAILED, exitCode);
        assertTrue(err.toString().contains("error: The DefGadget field is not valid"));
    }

    @Test
    void testIncompleteLocationMapFailsTranslation() throws Exception {
        Path ast = write("ast.json", AST);
        Path loc = write("loc.json", "{ \"5\": { \"file\": \"a.fpp\" } }");

        int exitCode = cmd.execute("-q", ast.toString(), loc.toString());

        assertEquals(FppToAstCommand.EXIT_TRANSLATION_FAILED, exitCode);
        assertTrue(err.toString().contains("missing required field pos"));
    }

    @Test
    void testMissingProviderFailsTranslation() throws Exception {
        Path ast = write("ast.json", AST);
        Path loc = write("loc.json", LOCATIONS);
        CommandLine noProvider = FppToAstCommand.commandLine(new FppToAstCommand(() -> {
            throw new IllegalStateException("No AstJsonProvider found on the classpath.");
        }));
        noProvider.setOut(new PrintWriter(out));
        noProvider.setErr(new PrintWriter(err));

        int exitCode = noProvider.execute("-q", ast.toString(), loc.toString());

        assertEquals(FppToAstCommand.EXIT_TRANSLATION_FAILED, exitCode);
        assertTrue(err.toString().contains("error: No AstJsonProvider found on the classpath."));
    }

    @Test
    void testMissingArgumentsIsUsageError() {
        int exitCode = cmd.execute();

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
    }
}
