package work.lcod.specdoc.node;

final class Texts {
    private Texts() {}

    static String requireText(String nodeType, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new AuthoringException(nodeType, field + " must not be empty");
        }
        return value;
    }

    static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
