package works.envbind.exceptions;

import java.lang.reflect.Type;

public final class UnsupportedFieldTypeException extends Exception {
	private final Type fieldType;

	public Type fieldType() {
		return this.fieldType;
	}

	public UnsupportedFieldTypeException(Type fieldType) {
		this(fieldType, "unsupported field type " + fieldType.getTypeName());
	}

	public UnsupportedFieldTypeException(Type fieldType, String message) {
		super(message);
		this.fieldType = fieldType;
	}

	public UnsupportedFieldTypeException(Type fieldType, String message, Throwable cause) {
		super(message, cause);
		this.fieldType = fieldType;
	}
}
