package io.dsh.shell.cli.completion.dynamic;

import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Gson adapter for {@link MatchCondition}.
 *
 * <p>Accepts a bare string ({@code "HasSubcommand"}) or an adjacently tagged object ({@code
 * {"type": "CustomPattern", "params": {...}}}). Positional constraints are pairs: {@code
 * "args_positional": [[0, "install"]]}.
 */
final class MatchConditionAdapter implements JsonDeserializer<MatchCondition> {

  @Override
  public MatchCondition deserialize(
      JsonElement json, Type typeOfT, JsonDeserializationContext ctx) {
    if (json == null || json.isJsonNull()) {
      return null;
    }
    if (json.isJsonPrimitive()) {
      return fromTag(json.getAsString(), new JsonObject());
    }
    if (!json.isJsonObject() || !json.getAsJsonObject().has("type")) {
      throw new JsonParseException("Match condition must be a string or a typed object: " + json);
    }
    JsonObject obj = json.getAsJsonObject();
    JsonElement params = obj.get("params");
    if (params != null && !params.isJsonNull() && !params.isJsonObject()) {
      throw new JsonParseException("Match condition params must be an object: " + params);
    }
    return fromTag(
        obj.get("type").getAsString(),
        params == null || params.isJsonNull() ? new JsonObject() : params.getAsJsonObject());
  }

  private static MatchCondition fromTag(String tag, JsonObject params) {
    return switch (tag) {
      case "StartsWithCommand" -> new MatchCondition.StartsWithCommand();
      case "HasSubcommand" -> new MatchCondition.HasSubcommand();
      case "SecondArgument" -> new MatchCondition.SecondArgument();
      case "ThirdArgument" -> new MatchCondition.ThirdArgument();
      case "CustomPattern" -> customPattern(params);
      default -> throw new JsonParseException("Unknown match condition: " + tag);
    };
  }

  private static MatchCondition.CustomPattern customPattern(JsonObject params) {
    JsonElement command = params.get("command");
    JsonElement mustBeEmpty = params.get("args_must_be_empty");
    return new MatchCondition.CustomPattern(
        command == null || command.isJsonNull() ? null : command.getAsString(),
        strings(params, "subcommands"),
        strings(params, "args_contains"),
        strings(params, "options_contains"),
        mustBeEmpty != null && !mustBeEmpty.isJsonNull() && mustBeEmpty.getAsBoolean(),
        positionals(params));
  }

  private static List<String> strings(JsonObject params, String key) {
    JsonElement data = params.get(key);
    if (data == null || data.isJsonNull()) {
      return List.of();
    }
    if (!data.isJsonArray()) {
      throw new JsonParseException(key + " expects an array of strings");
    }
    List<String> values = new ArrayList<>();
    for (JsonElement e : data.getAsJsonArray()) {
      if (!e.isJsonPrimitive()) {
        throw new JsonParseException(key + " expects an array of strings");
      }
      values.add(e.getAsString());
    }
    return values;
  }

  private static List<MatchCondition.Positional> positionals(JsonObject params) {
    JsonElement data = params.get("args_positional");
    if (data == null || data.isJsonNull()) {
      return List.of();
    }
    if (!data.isJsonArray()) {
      throw new JsonParseException("args_positional expects an array of [index, value] pairs");
    }
    List<MatchCondition.Positional> values = new ArrayList<>();
    for (JsonElement e : data.getAsJsonArray()) {
      if (!e.isJsonArray() || e.getAsJsonArray().size() != 2) {
        throw new JsonParseException("args_positional expects [index, value] pairs: " + e);
      }
      JsonArray pair = e.getAsJsonArray();
      int index = pair.get(0).getAsInt();
      if (index < 0) {
        throw new JsonParseException("args_positional index must not be negative: " + e);
      }
      values.add(new MatchCondition.Positional(index, pair.get(1).getAsString()));
    }
    return values;
  }
}
