package absstr.domain;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.HashSet;

/**
 * JSON encoding of the string domains.
 *
 * Top is the string {@code "Top"}; values are {@code {"Value": ...}}, so
 * that top and the empty value stay distinct.
 */
public final class Serialization {
	private static final String TOP = "Top";
	private static final String VALUE = "Value";

	private Serialization() {
	}

	/**
	 * @return A Gson instance that knows the string domains.
	 */
	public static Gson gson() {
		return new GsonBuilder()
			.registerTypeAdapter(CharacterSet.class, new CharacterSetAdapter().nullSafe())
			.registerTypeAdapter(CharacterInclusionDomain.class, new CharacterInclusionAdapter().nullSafe())
			.create();
	}

	/**
	 * Reads either "Top" or the start of {"Value": ...}.
	 *
	 * @return Whether the value was top.
	 */
	private static boolean readTopOrBeginValue(JsonReader in) throws IOException {
		if (in.peek() == JsonToken.STRING) {
			var str = in.nextString();
			if (!TOP.equals(str)) {
				throw new JsonParseException("Expected \"Top\", got \"" + str + "\"");
			}
			return true;
		}

		in.beginObject();
		var name = in.nextName();
		if (!VALUE.equals(name)) {
			throw new JsonParseException("Expected \"Value\", got \"" + name + "\"");
		}
		return false;
	}

	private static final class CharacterSetAdapter extends TypeAdapter<CharacterSet> {
		@Override
		public void write(JsonWriter out, CharacterSet value) throws IOException {
			if (value.isTop()) {
				out.value(TOP);
				return;
			}

			var str = new StringBuilder();
			value.unwrapValue().stream()
				.sorted()
				.forEach(str::append);
			out.beginObject();
			out.name(VALUE).value(str.toString());
			out.endObject();
		}

		@Override
		public CharacterSet read(JsonReader in) throws IOException {
			if (readTopOrBeginValue(in)) {
				return CharacterSet.topValue();
			}

			var chars = new HashSet<Character>();
			for (char c : in.nextString().toCharArray()) {
				chars.add(c);
			}
			in.endObject();
			return CharacterSet.of(chars);
		}
	}

	private static final class CharacterInclusionAdapter extends TypeAdapter<CharacterInclusionDomain> {
		private final CharacterSetAdapter sets = new CharacterSetAdapter();

		@Override
		public void write(JsonWriter out, CharacterInclusionDomain value) throws IOException {
			if (value.isTop()) {
				out.value(TOP);
				return;
			}

			out.beginObject();
			out.name(VALUE);
			out.beginArray();
			this.sets.write(out, value.certain());
			this.sets.write(out, value.possible());
			out.endArray();
			out.endObject();
		}

		@Override
		public CharacterInclusionDomain read(JsonReader in) throws IOException {
			if (readTopOrBeginValue(in)) {
				return CharacterInclusionDomain.topValue();
			}

			in.beginArray();
			var certain = this.sets.read(in);
			var possible = this.sets.read(in);
			in.endArray();
			in.endObject();
			if (certain.isTop() || !possible.containsAll(certain)) {
				throw new JsonParseException("Certain characters " + certain + " are not a subset of " + possible);
			}
			return CharacterInclusionDomain.of(certain, possible);
		}
	}
}
