package cli;

import app.Nl2SqlCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Orchestration lives in {@link Nl2SqlCliApp}; this class only forwards so run scripts
 * keep a stable main class.</p>
 */
public class Nl2SqlCli {

    public static void main(String[] args) throws Exception {
        Nl2SqlCliApp.main(args);
    }
}
