package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.StatusChange;
import com.nisfix.compliance.infrastructure.jpa.StatusChangeEmbeddable;

import java.util.List;

/**
 * Maps append-only status history between the domain and its element collection.
 */
final class StatusHistoryMapper {

    private StatusHistoryMapper() {}

    static <S extends Enum<S>> List<StatusChange<S>> toDomain(List<StatusChangeEmbeddable> rows, Class<S> type) {
        return rows.stream()
                .map(row -> new StatusChange<>(
                        row.getFromStatus() == null ? null : Enum.valueOf(type, row.getFromStatus()),
                        Enum.valueOf(type, row.getToStatus()),
                        row.getChangedBy(),
                        row.getReason(),
                        row.getChangedAt()))
                .toList();
    }

    /** Copies only the entries the stored history does not have yet; existing rows are never rewritten. */
    static <S extends Enum<S>> void appendNew(List<StatusChangeEmbeddable> rows, List<StatusChange<S>> history) {
        for (int i = rows.size(); i < history.size(); i++) {
            StatusChange<S> change = history.get(i);
            rows.add(new StatusChangeEmbeddable(
                    change.getFromStatus() == null ? null : change.getFromStatus().name(),
                    change.getToStatus().name(),
                    change.getChangedBy(),
                    change.getReason(),
                    change.getChangedAt()));
        }
    }

    static String name(Enum<?> value) {
        return value == null ? null : value.name();
    }
}
