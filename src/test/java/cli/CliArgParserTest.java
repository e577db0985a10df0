package cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @AfterEach
    void cleanupProps() {
        System.clearProperty("recipesTable");
    }

    @Test
    void parseArgs_acceptsBothForms() {
        Map<String, String> argv = CliArgParser.parseArgs(new String[]{
                "--workbook=data/book.xlsx", "--out", "target/out", "--failOnError", "stray", "--saveWorkbook="
        });

        assertEquals("data/book.xlsx", argv.get("workbook"));
        assertEquals("target/out", argv.get("out"));
        assertEquals("stray", argv.get("failOnError"));
        assertEquals("", argv.get("saveWorkbook"));
        assertTrue(CliArgParser.parseArgs(null).isEmpty());
    }

    @Test
    void flag_presenceStyle() {
        Map<String, String> argv = CliArgParser.parseArgs(new String[]{"--a", "--b=false", "--c=yes"});

        assertTrue(CliArgParser.flag(argv, "a"));
        assertFalse(CliArgParser.flag(argv, "b"));
        assertTrue(CliArgParser.flag(argv, "c"));
        assertFalse(CliArgParser.flag(argv, "d"));
    }

    @Test
    void option_fallsBackToSystemPropertyThenDefault() {
        Map<String, String> argv = CliArgParser.parseArgs(new String[]{"--potionsTable=Brews"});
        System.setProperty("recipesTable", "Mixes");

        assertEquals("Brews", CliArgParser.option(argv, "potionsTable", "Potions"));
        assertEquals("Mixes", CliArgParser.option(argv, "recipesTable", "Recipes"));
        assertEquals("Ingredients", CliArgParser.option(argv, "ingredientsTable", "Ingredients"));
    }

    @Test
    void parseNumbersAndBooleans() {
        assertEquals(5, CliArgParser.parseInt(" 5 ", 1));
        assertEquals(1, CliArgParser.parseInt("five", 1));
        assertTrue(CliArgParser.parseBoolean("Y", false));
        assertFalse(CliArgParser.parseBoolean("nope", true));
        assertTrue(CliArgParser.parseBoolean(" ", true));
    }
}
