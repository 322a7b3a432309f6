package ir.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Named ({@code %Qubit = type opaque}) or literal ({@code { i32, float }})
 * structure. Named structs are owned by their module and compared by name.
 */
public final class StructType extends Type {
    private final String name;
    private List<Type> body;

    private StructType(String name, List<Type> body) {
        super(TypeKind.STRUCT);
        this.name = name;
        this.body = body;
    }

    /**
     * Creates an opaque named struct; use {@link #setBody(List)} to complete it.
     */
    public static StructType createNamed(String name) {
        return new StructType(Objects.requireNonNull(name, "name"), null);
    }

    public static StructType literal(List<Type> elements) {
        return new StructType(null, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public String getName() { return name; }
    public boolean isLiteral() { return name == null; }
    public boolean isOpaque() { return body == null; }

    public List<Type> getBody() {
        return body == null ? List.of() : body;
    }

    public void setBody(List<Type> elements) {
        this.body = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    /**
     * @return the definition as it appears on the right of {@code %Name = type}
     */
    public String getBodyIR() {
        if (body == null) {
            return "opaque";
        }
        StringBuilder sb = new StringBuilder("{ ");
        for (int i = 0; i < body.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(body.get(i).toIR());
        }
        return sb.append(" }").toString();
    }

    @Override
    public String toIR() {
        return isLiteral() ? getBodyIR() : "%" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType other)) return false;
        if (isLiteral() || other.isLiteral()) {
            return isLiteral() && other.isLiteral() && getBody().equals(other.getBody());
        }
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return isLiteral() ? Objects.hash(super.hashCode(), getBody()) : Objects.hash(super.hashCode(), name);
    }
}
