package infra.console;

import domain.correct.Revision;
import domain.correct.RevisionResolver;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interactive resolver: lists the options and asks for a number until a valid one is typed.
 *
 * <p>End of input keeps the original text (option 1).</p>
 */
public final class ConsoleRevisionResolver implements RevisionResolver {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleRevisionResolver() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleRevisionResolver(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public int choose(Revision revision, List<String> options) {
        String word = revision.getOriginal();
        out.println();
        out.println("La palabra '" + word + "' no parece ser una tabla o columna válida.");
        out.println("Posibles traducciones o correcciones:");
        for (int i = 0; i < options.size(); i++) {
            out.println("  " + (i + 1) + ". " + options.get(i));
        }

        while (true) {
            out.print("Por favor, elige la opción correcta para '" + word + "' (1-" + options.size() + "): ");
            out.flush();

            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read choice from console", e);
            }
            if (line == null) {
                out.println();
                out.println("[WARN] end of input, keeping '" + word + "'.");
                return 1;
            }

            int choice;
            try {
                choice = Integer.parseInt(line.trim());
            } catch (NumberFormatException e) {
                out.println("Entrada inválida. Por favor, ingresa un número.");
                continue;
            }
            if (choice < 1 || choice > options.size()) {
                out.println("Opción no válida. Por favor, ingresa un número dentro del rango.");
                continue;
            }
            return choice;
        }
    }
}
