package infra.text;

import domain.text.QueryTextProvider;
import domain.text.QueryTextResolution;

/** Query given directly on the command line (--query). */
public final class ArgumentQueryTextProvider implements QueryTextProvider {

    private final String text;

    public ArgumentQueryTextProvider(String text) {
        this.text = text;
    }

    @Override
    public QueryTextResolution resolve() {
        if (text == null || text.isBlank()) {
            return QueryTextResolution.ofExample(EXAMPLE_QUERY, "--query is blank");
        }
        return QueryTextResolution.ofArgument(text.strip());
    }
}
