package me.christianrobert.py2lua.transformation.resolver;

/**
 * One locally bound import name and where it came from.
 *
 * <p>Examples:
 * <pre>
 * from cc_lib import peripheral          → peripheral → (cc_lib, peripheral)
 * from cc_lib import peripheral as p     → p          → (cc_lib, peripheral)
 * import cc_lib as lib                   → lib        → (cc_lib, null)
 * </pre>
 */
public class ImportBinding {

    private final String localName;
    private final String origin;
    private final String exportedName;  // null for plain "import module"

    public ImportBinding(String localName, String origin, String exportedName) {
        if (localName == null || localName.trim().isEmpty()) {
            throw new IllegalArgumentException("Import binding local name cannot be null or empty");
        }
        if (origin == null || origin.trim().isEmpty()) {
            throw new IllegalArgumentException("Import binding origin cannot be null or empty");
        }
        this.localName = localName;
        this.origin = origin;
        this.exportedName = exportedName;
    }

    public String getLocalName() {
        return localName;
    }

    public String getOrigin() {
        return origin;
    }

    public String getExportedName() {
        return exportedName;
    }

    public boolean hasExportedName() {
        return exportedName != null;
    }

    @Override
    public String toString() {
        return "ImportBinding{" + localName + " -> " + origin +
                (exportedName != null ? "." + exportedName : "") + "}";
    }
}
