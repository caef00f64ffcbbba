package io.dsh.shell.cli.completion.schema;

import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gson adapter for {@link ArgumentType}.
 *
 * <p>Accepts three spellings:
 *
 * <ul>
 *   <li>a bare string: {@code "Directory"}
 *   <li>externally tagged: {@code {"File": {"extensions": [".rs"]}}}, {@code {"Choice": ["a"]}}
 *   <li>adjacently tagged: {@code {"type": "Choice", "data": ["a", "b"]}}
 * </ul>
 *
 * Serialization always writes the adjacently tagged form.
 */
final class ArgumentTypeAdapter
    implements JsonDeserializer<ArgumentType>, JsonSerializer<ArgumentType> {

  @Override
  public ArgumentType deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext ctx) {
    if (json == null || json.isJsonNull()) {
      return null;
    }
    if (json.isJsonPrimitive()) {
      return fromTag(json.getAsString(), JsonNull.INSTANCE);
    }
    if (!json.isJsonObject()) {
      throw new JsonParseException("Argument type must be a string or an object: " + json);
    }

    JsonObject obj = json.getAsJsonObject();
    if (obj.has("type")) {
      JsonElement data = obj.has("data") ? obj.get("data") : JsonNull.INSTANCE;
      return fromTag(obj.get("type").getAsString(), data);
    }
    if (obj.size() != 1) {
      throw new JsonParseException("Argument type object must have exactly one tag: " + json);
    }
    Map.Entry<String, JsonElement> entry = obj.entrySet().iterator().next();
    return fromTag(entry.getKey(), entry.getValue());
  }

  @Override
  public JsonElement serialize(ArgumentType src, Type typeOfSrc, JsonSerializationContext ctx) {
    JsonObject obj = new JsonObject();
    obj.addProperty("type", src.typeName());
    if (src instanceof ArgumentType.File file && !file.extensions().isEmpty()) {
      JsonObject data = new JsonObject();
      data.add("extensions", toArray(file.extensions()));
      obj.add("data", data);
    } else if (src instanceof ArgumentType.Choice choice) {
      obj.add("data", toArray(choice.values()));
    }
    return obj;
  }

  private static ArgumentType fromTag(String tag, JsonElement data) {
    return switch (tag) {
      case "File" -> new ArgumentType.File(extensions(data));
      case "Directory" -> new ArgumentType.Directory();
      case "Choice" -> new ArgumentType.Choice(strings(data, "Choice"));
      case "Command" -> new ArgumentType.Command();
      case "CommandWithArgs" -> new ArgumentType.CommandWithArgs();
      case "Environment" -> new ArgumentType.Environment();
      case "String" -> new ArgumentType.Text();
      case "Signal" -> new ArgumentType.Signal();
      case "User" -> new ArgumentType.User();
      case "Group" -> new ArgumentType.Group();
      case "Interface" -> new ArgumentType.Interface();
      default -> throw new JsonParseException("Unknown argument type: " + tag);
    };
  }

  private static List<String> extensions(JsonElement data) {
    if (data == null || data.isJsonNull()) {
      return List.of();
    }
    if (data.isJsonObject()) {
      JsonElement exts = data.getAsJsonObject().get("extensions");
      return exts == null || exts.isJsonNull() ? List.of() : strings(exts, "File.extensions");
    }
    return strings(data, "File");
  }

  private static List<String> strings(JsonElement data, String where) {
    if (data == null || !data.isJsonArray()) {
      throw new JsonParseException(where + " expects an array of strings");
    }
    List<String> values = new ArrayList<>();
    for (JsonElement e : data.getAsJsonArray()) {
      if (!e.isJsonPrimitive()) {
        throw new JsonParseException(where + " expects an array of strings");
      }
      values.add(e.getAsString());
    }
    return values;
  }

  private static JsonArray toArray(List<String> values) {
    JsonArray array = new JsonArray();
    values.forEach(v -> array.add(new JsonPrimitive(v)));
    return array;
  }
}
