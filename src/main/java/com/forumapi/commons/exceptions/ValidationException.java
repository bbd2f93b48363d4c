package com.forumapi.commons.exceptions;

public class ValidationException extends DomainException {

    public enum Kind {
        NOT_CONTAIN_NEEDED_PROPERTY,
        NOT_MEET_DATA_TYPE_SPECIFICATION,
        USERNAME_LIMIT_CHAR,
        USERNAME_CONTAIN_RESTRICTED_CHARACTER
    }

    private final String entity;
    private final Kind kind;
    private final String property;

    public ValidationException(String entity, Kind kind, String property) {
        super(entity + "." + kind.name(), describe(kind, property));
        this.entity = entity;
        this.kind = kind;
        this.property = property;
    }

    public String getEntity() {
        return entity;
    }

    public Kind getKind() {
        return kind;
    }

    public String getProperty() {
        return property;
    }

    private static String describe(Kind kind, String property) {
        return switch (kind) {
            case NOT_CONTAIN_NEEDED_PROPERTY -> "missing required property '" + property + "'";
            case NOT_MEET_DATA_TYPE_SPECIFICATION -> "property '" + property + "' has the wrong data type";
            case USERNAME_LIMIT_CHAR -> "'" + property + "' exceeds the 50 character limit";
            case USERNAME_CONTAIN_RESTRICTED_CHARACTER -> "'" + property + "' contains a restricted character";
        };
    }
}
