package me.christianrobert.py2lua.transformation.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of all import bindings of one translation unit, keyed by local name.
 * Built once by {@link ImportResolver}, never mutated afterwards.
 */
public class ImportBindings {

    private final Map<String, ImportBinding> bindingsByLocalName;

    ImportBindings(Map<String, ImportBinding> bindingsByLocalName) {
        this.bindingsByLocalName = Collections.unmodifiableMap(new LinkedHashMap<>(bindingsByLocalName));
    }

    public static ImportBindings empty() {
        return new ImportBindings(Collections.emptyMap());
    }

    /**
     * @param localName Name as used in the source module
     * @return Binding or null if the name was not imported
     */
    public ImportBinding resolve(String localName) {
        if (localName == null) {
            return null;
        }
        return bindingsByLocalName.get(localName);
    }

    public boolean isImported(String localName) {
        return resolve(localName) != null;
    }

    public int size() {
        return bindingsByLocalName.size();
    }

    public Map<String, ImportBinding> asMap() {
        return bindingsByLocalName;
    }

    @Override
    public String toString() {
        return "ImportBindings{" + bindingsByLocalName.values() + "}";
    }
}
