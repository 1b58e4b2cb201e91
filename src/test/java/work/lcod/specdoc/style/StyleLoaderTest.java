package work.lcod.specdoc.style;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StyleLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void emptyDocumentYieldsDefaults() {
        assertEquals(StyleConstants.defaults(), StyleLoader.parse(""));
    }

    @Test
    void nullPathYieldsDefaults() {
        assertEquals(StyleConstants.defaults(), StyleLoader.load(null));
    }

    @Test
    void overridesTopLevelAndNestedKeys() {
        var style = StyleLoader.parse(String.join("\n",
            "body_font = \"Georgia\"",
            "body_size = 22",
            "[margins]",
            "left = 1080",
            "right = 1080",
            "[palette]",
            "heading_color = \"102030\""
        ));
        assertEquals("Georgia", style.bodyFont());
        assertEquals(22, style.bodySize());
        assertEquals(1080, style.margins().left());
        assertEquals(1440, style.margins().top());
        assertEquals(12240 - 2160, style.pageContentWidth());
        assertEquals("102030", style.palette().headingColor());
        assertEquals(Palette.defaults().codeFill(), style.palette().codeFill());
    }

    @Test
    void rejectsUnknownKeys() {
        var ex = assertThrows(IllegalArgumentException.class, () -> StyleLoader.parse("body_fnt = \"Georgia\""));
        assertTrue(ex.getMessage().contains("body_fnt"));
    }

    @Test
    void rejectsWrongValueTypes() {
        var ex = assertThrows(IllegalArgumentException.class, () -> StyleLoader.parse("body_size = \"large\""));
        assertTrue(ex.getMessage().contains("body_size"));
    }

    @Test
    void rejectsIntegersBeyondIntRange() {
        var ex = assertThrows(IllegalArgumentException.class, () -> StyleLoader.parse("[margins]\nleft = 4294967296"));
        assertTrue(ex.getMessage().contains("left"), ex.getMessage());
    }

    @Test
    void rejectsMalformedToml() {
        assertThrows(IllegalArgumentException.class, () -> StyleLoader.parse("body_font = "));
    }

    @Test
    void loadsFromFile() throws Exception {
        var file = tempDir.resolve("style.toml");
        Files.writeString(file, "code_font = \"Menlo\"\n");
        assertEquals("Menlo", StyleLoader.load(file).codeFont());
    }

    @Test
    void missingFileIsReported() {
        var missing = tempDir.resolve("absent.toml");
        var ex = assertThrows(IllegalArgumentException.class, () -> StyleLoader.load(missing));
        assertTrue(ex.getMessage().contains("absent.toml"));
    }
}
