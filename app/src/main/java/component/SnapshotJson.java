package component;

import com.google.gson.*;
import java.awt.Color;

import logic.BoardSnapshot;

/**
 * BoardSnapshot ⇄ JSON (Gson).
 * 색은 {r,g,b,a} 객체, 빈 칸은 null.
 */
public class SnapshotJson {
    private static final Gson gson = new GsonBuilder()
            .serializeNulls()
            .registerTypeAdapter(Color.class, new JsonSerializer<Color>() {
                @Override
                public JsonElement serialize(Color c, java.lang.reflect.Type typeOfSrc,
                        JsonSerializationContext context) {
                    if (c == null)
                        return JsonNull.INSTANCE;
                    JsonObject obj = new JsonObject();
                    obj.addProperty("r", c.getRed());
                    obj.addProperty("g", c.getGreen());
                    obj.addProperty("b", c.getBlue());
                    obj.addProperty("a", c.getAlpha());
                    return obj;
                }
            })
            .registerTypeAdapter(Color.class, new JsonDeserializer<Color>() {
                @Override
                public Color deserialize(JsonElement json, java.lang.reflect.Type typeOfT,
                        JsonDeserializationContext context)
                        throws JsonParseException {
                    if (json == null || json.isJsonNull())
                        return null;
                    JsonObject obj = json.getAsJsonObject();
                    int r = obj.get("r").getAsInt();
                    int g = obj.get("g").getAsInt();
                    int b = obj.get("b").getAsInt();
                    int a = obj.has("a") ? obj.get("a").getAsInt() : 255;
                    return new Color(r, g, b, a);
                }
            })
            .create();

    private SnapshotJson() {}

    public static String toJson(BoardSnapshot snapshot) {
        return gson.toJson(snapshot);
    }

    public static BoardSnapshot fromJson(String json) {
        BoardSnapshot snapshot = gson.fromJson(json, BoardSnapshot.class);
        if (snapshot == null)
            throw new JsonParseException("empty snapshot json");
        return snapshot;
    }
}
