package work.lcod.specdoc.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Preformatted lines rendered in the code font, one paragraph per line.
 */
public record CodeBlock(List<String> lines) implements ContentNode {
    public CodeBlock {
        if (lines == null || lines.isEmpty()) {
            throw new AuthoringException("code_block", "at least one line is required");
        }
        var copy = new ArrayList<String>(lines.size());
        lines.forEach(line -> copy.add(Texts.orEmpty(line)));
        lines = List.copyOf(copy);
    }

    @Override
    public String type() {
        return "code_block";
    }
}
