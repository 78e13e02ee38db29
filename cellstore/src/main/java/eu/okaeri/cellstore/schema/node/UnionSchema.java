package eu.okaeri.cellstore.schema.node;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.FieldError;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accepts a value matching at least one member. A nullable type ({@code ["string", "null"]})
 * reports the errors of its only non-null member, other unions report {@code Invalid input}.
 */
@Getter
public class UnionSchema extends SchemaNode {

    private final List<SchemaNode> members;

    public UnionSchema(@NonNull List<SchemaNode> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("union requires at least one member");
        }
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
    }

    @Override
    public void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors) {

        List<List<FieldError>> failures = new ArrayList<>();
        for (SchemaNode member : this.members) {
            List<FieldError> memberErrors = new ArrayList<>();
            member.validate(value, path, memberErrors);
            if (memberErrors.isEmpty()) {
                return;
            }
            failures.add(memberErrors);
        }

        List<List<FieldError>> nonNull = new ArrayList<>();
        for (int index = 0; index < this.members.size(); index++) {
            if (!(this.members.get(index) instanceof NullSchema)) {
                nonNull.add(failures.get(index));
            }
        }

        if (nonNull.size() == 1) {
            errors.addAll(nonNull.get(0));
            return;
        }

        errors.add(new FieldError(path, "Invalid input"));
    }
}
