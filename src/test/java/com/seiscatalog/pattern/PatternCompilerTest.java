package com.seiscatalog.pattern;

import com.seiscatalog.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class PatternCompilerTest {

    @TempDir
    Path root;

    private PatternCompiler compiler() {
        return new PatternCompiler(FieldRegistry.defaults());
    }

    @Test
    void compilesTemplateAnchoredAtRoot() throws Exception {
        Files.createDirectories(root.resolve("2023"));
        Pattern pattern = compiler().check(root.toString(), "{home}/{YYYY}/{station}_{component}.sac");

        Matcher m = pattern.matcher(root.resolve("2023/ABC_BHZ.sac").toString());
        assertTrue(m.matches());
        assertEquals("2023", m.group("year"));
        assertEquals("ABC", m.group("station"));
        assertEquals("BHZ", m.group("component"));

        assertFalse(pattern.matcher("/elsewhere/2023/ABC_BHZ.sac").matches());
        assertFalse(pattern.matcher(root.resolve("2023/ABC_BHZ.sac.bak").toString()).matches());
    }

    @Test
    void missingStationIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> compiler().check(root.toString(), "{home}/{YYYY}/some_{component}.sac"));
        assertTrue(e.getMessage().contains("{station}"));
    }

    @Test
    void missingHomeIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> compiler().check(root.toString(), "/data/{YYYY}/{station}_{component}.sac"));
        assertTrue(e.getMessage().contains("{home}"));
    }

    @Test
    void unknownTokenIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> compiler().check(root.toString(), "{home}/{YYYY}/{station}_{component}.{format}"));
        assertTrue(e.getMessage().contains("format"));
    }

    @Test
    void duplicateTokenIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> compiler().check(root.toString(), "{home}/{YYYY}/{station}/{station}_{component}.sac"));
        assertTrue(e.getMessage().contains("duplicate"));
    }

    @Test
    void templateWithoutDateFieldsIsRejected() {
        assertThrows(ConfigurationException.class,
                () -> compiler().check(root.toString(), "{home}/{station}_{component}.sac"));
    }

    @Test
    void dateRuleCanBeSwitchedOff() {
        PatternCompiler lenient = new PatternCompiler(FieldRegistry.defaults(), TemplateRules.withoutDateFields());
        Pattern pattern = lenient.check(root.toString(), "{home}/{station}_{component}.sac");
        assertTrue(pattern.matcher(root.resolve("ABC_BHZ.sac").toString()).matches());
    }

    @Test
    void nullTemplateIsRejected() {
        assertThrows(ConfigurationException.class, () -> compiler().check(root.toString(), null));
    }

    @Test
    void missingRootOnlyWarns() {
        Path missing = root.resolve("not-there");
        Pattern pattern = compiler().check(missing.toString(), "{home}/{YYYY}/{station}_{component}.sac");
        assertTrue(pattern.matcher(missing.resolve("2023/ABC_BHZ.sac").toString()).matches());
    }

    @Test
    void rootIsNormalized() {
        String unnormalized = root.resolve("a").resolve("..").toString();
        Pattern pattern = compiler().check(unnormalized, "{home}/{YYYY}/{station}_{component}.sac");
        assertTrue(pattern.matcher(root.resolve("2023/ABC_BHZ.sac").toString()).matches());
    }

    @Test
    void regexCharactersInRootAreLiteral() throws Exception {
        Path odd = Files.createDirectories(root.resolve("data+(1)"));
        Pattern pattern = compiler().check(odd.toString(), "{home}/{YYYY}/{station}_{component}.sac");
        assertTrue(pattern.matcher(odd.resolve("2023/ABC_BHZ.sac").toString()).matches());
    }
}
