package com.narrateplus.tts;

/**
 * Minimal JSON helper for the small flat payloads exchanged with the bridge.
 * Avoids adding new dependencies.
 */
public final class SimpleJson
{
    private SimpleJson()
    {
    }

    /**
     * Builds a flat object from key/value pairs. Null values are skipped.
     */
    public static String object(String... keyValues)
    {
        if (keyValues.length % 2 != 0)
        {
            throw new IllegalArgumentException("Expected key/value pairs");
        }

        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < keyValues.length; i += 2)
        {
            if (keyValues[i + 1] == null)
            {
                continue;
            }
            if (sb.length() > 1)
            {
                sb.append(',');
            }
            sb.append('"').append(escape(keyValues[i])).append("\":\"").append(escape(keyValues[i + 1])).append('"');
        }
        return sb.append('}').toString();
    }

    public static String extractString(String json, String key)
    {
        if (json == null || key == null)
        {
            return null;
        }

        // finds "key" : "value"
        String needle = "\"" + key + "\"";
        int k = json.indexOf(needle);
        if (k < 0)
        {
            return null;
        }
        int colon = json.indexOf(':', k + needle.length());
        if (colon < 0)
        {
            return null;
        }
        int firstQuote = json.indexOf('"', colon + 1);
        if (firstQuote < 0)
        {
            return null;
        }

        StringBuilder sb = new StringBuilder();
        boolean esc = false;
        for (int i = firstQuote + 1; i < json.length(); i++)
        {
            char c = json.charAt(i);
            if (esc)
            {
                switch (c)
                {
                    case 'b': sb.append('\b'); break;
                    case 'f': sb.append('\f'); break;
                    case 'n': sb.append('\n'); break;
                    case 'r': sb.append('\r'); break;
                    case 't': sb.append('\t'); break;
                    case 'u':
                        if (i + 4 < json.length())
                        {
                            sb.append((char) Integer.parseInt(json.substring(i + 1, i + 5), 16));
                            i += 4;
                        }
                        break;
                    default: sb.append(c); break;
                }
                esc = false;
            }
            else if (c == '\\')
            {
                esc = true;
            }
            else if (c == '"')
            {
                return sb.toString();
            }
            else
            {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escape(String s)
    {
        StringBuilder out = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++)
        {
            char c = s.charAt(i);
            switch (c)
            {
                case '"': out.append("\\\""); break;
                case '\\': out.append("\\\\"); break;
                case '\b': out.append("\\b"); break;
                case '\f': out.append("\\f"); break;
                case '\n': out.append("\\n"); break;
                case '\r': out.append("\\r"); break;
                case '\t': out.append("\\t"); break;
                default:
                    if (c < 0x20)
                    {
                        out.append(String.format("\\u%04x", (int) c));
                    }
                    else
                    {
                        out.append(c);
                    }
            }
        }
        return out.toString();
    }
}
