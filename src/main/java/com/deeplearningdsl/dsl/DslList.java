package com.deeplearningdsl.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class DslList extends DslValue {
    public final List<DslValue> elements;

    public DslList(List<DslValue> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public int size() {
        return elements.size();
    }

    public DslValue get(int index) {
        return elements.get(index);
    }

    @Override
    public Kind kind() {
        return Kind.LIST;
    }

    @Override
    public boolean isTruthy() {
        return !elements.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof DslList)) return false;
        return elements.equals(((DslList)other).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) builder.append(", ");
            DslValue el = elements.get(i);
            if (el instanceof DslString) {
                builder.append('"').append(el).append('"');
            } else {
                builder.append(el);
            }
        }
        return builder.append("]").toString();
    }
}
