package works.envbind;

/**
 * Derives environment variable names from Java identifiers.
 */
public final class EnvNames {
	private EnvNames() { }

	/**
	 * Converts a camel-case identifier to upper-case words separated by underscores.
	 * <p>
	 * A separator goes between a lower-case letter and a following upper-case letter ({@code fooBar} → {@code FOO_BAR}),
	 * before an upper-case letter that starts a lower-case run ({@code JSONString} → {@code JSON_STRING}),
	 * and wherever letters meet digits ({@code JSON1String} → {@code JSON_1_STRING}).
	 * Underscores already in the identifier are kept, but never doubled or leading.
	 * Applying this to its own output changes nothing.
	 */
	public static String deriveName(String identifier) {
		int[] cps = identifier.codePoints().toArray();
		StringBuilder sb = new StringBuilder(cps.length + 4);
		for (int i = 0; i < cps.length; i++) {
			int cur = cps[i];
			if (cur == '_') {
				appendSeparator(sb);
				continue;
			}
			if (i > 0 && isBoundary(cps[i - 1], cur, (i + 1 < cps.length) ? cps[i + 1] : -1)) {
				appendSeparator(sb);
			}
			sb.appendCodePoint(Character.toUpperCase(cur));
		}
		return sb.toString();
	}

	private static boolean isBoundary(int prev, int cur, int next) {
		if (Character.isLowerCase(prev) && Character.isUpperCase(cur)) {
			return true;
		} else if (Character.isUpperCase(cur) && next != -1 && Character.isLowerCase(next)) {
			return true;
		} else if (Character.isLetter(prev) && Character.isDigit(cur)) {
			return true;
		} else {
			return Character.isDigit(prev) && Character.isLetter(cur);
		}
	}

	private static void appendSeparator(StringBuilder sb) {
		int length = sb.length();
		if (length != 0 && sb.charAt(length - 1) != '_') {
			sb.append('_');
		}
	}
}
