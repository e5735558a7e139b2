package infra.console;

import domain.correct.Revision;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleRevisionResolverTest {

    private static final List<String> OPTIONS = List.of("bontas", "ventas");

    @Test
    void should_reprompt_until_valid_choice() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        ConsoleRevisionResolver r = new ConsoleRevisionResolver(
                new BufferedReader(new StringReader("x\n9\n 2 \n")),
                new PrintStream(buf, true, StandardCharsets.UTF_8));

        int choice = r.choose(Revision.entity("bontas"), OPTIONS);

        assertEquals(2, choice);
        String out = buf.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("La palabra 'bontas' no parece ser una tabla o columna válida."));
        assertTrue(out.contains("2. ventas"));
        assertTrue(out.contains("Entrada inválida"));
        assertTrue(out.contains("Opción no válida"));
    }

    @Test
    void should_keep_original_on_end_of_input() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        ConsoleRevisionResolver r = new ConsoleRevisionResolver(
                new BufferedReader(new StringReader("")),
                new PrintStream(buf, true, StandardCharsets.UTF_8));

        assertEquals(1, r.choose(Revision.entity("bontas"), OPTIONS));
        assertTrue(buf.toString(StandardCharsets.UTF_8).contains("[WARN]"));
    }
}
