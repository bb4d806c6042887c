package nl.nfi.djwordlist.serialize;

import nl.nfi.djwordlist.generate.config.CaseMode;
import nl.nfi.djwordlist.generate.config.ConfigException;
import nl.nfi.djwordlist.generate.config.ExecutionMode;
import nl.nfi.djwordlist.generate.config.GeneratorConfig;
import nl.nfi.djwordlist.generate.mask.Mask;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link GeneratorConfig}, used to hand the configuration to worker processes.
 */
public final class ConfigCodec {

    private static final String FORMAT_VERSION = "1";

    private ConfigCodec() {
    }

    public static String encode(final GeneratorConfig config) {
        final JSONObject leet = new JSONObject();
        // JSONObject does not keep key order, so the map travels as a list of pairs
        final JSONArray leetEntries = new JSONArray();
        config.leetMap().forEach((key, replacements) -> leetEntries.put(new JSONArray()
                .put(String.valueOf(key))
                .put(new JSONArray(replacements))));
        leet.put("entries", leetEntries);
        leet.put("max_expansions", config.leetMaxExpansions());

        return new JSONObject()
                .put("version", FORMAT_VERSION)
                .put("words", new JSONArray(config.words()))
                .put("joiners", new JSONArray(config.joiners()))
                .put("max_permutation_length", config.maxPermutationLength())
                .put("masks", new JSONArray(config.masks().stream().map(Mask::template).toList()))
                .put("numbers", new JSONArray(config.numbers()))
                .put("symbols", new JSONArray(config.symbols()))
                .put("years", new JSONArray(config.years()))
                .put("cases", new JSONArray(config.cases().stream().map(Enum::name).toList()))
                .put("leet", leet)
                .put("min_length", config.minLength())
                .put("max_length", config.maxLength())
                .put("min_entropy", config.minEntropy())
                .put("blacklist", new JSONArray(config.blacklist()))
                .put("max_count", config.maxCount())
                .put("worker_count", config.workerCount())
                .put("execution_mode", config.executionMode().name())
                .toString();
    }

    public static GeneratorConfig decode(final String json) {
        try {
            final JSONObject object = new JSONObject(json);
            if (!FORMAT_VERSION.equals(object.getString("version"))) {
                throw new ConfigException("Unsupported configuration format version: %s".formatted(object.getString("version")));
            }

            final JSONObject leet = object.getJSONObject("leet");
            final Map<Character, List<String>> leetMap = new LinkedHashMap<>();
            final JSONArray leetEntries = leet.getJSONArray("entries");
            for (int i = 0; i < leetEntries.length(); i++) {
                final JSONArray entry = leetEntries.getJSONArray(i);
                leetMap.put(entry.getString(0).charAt(0), strings(entry.getJSONArray(1)));
            }

            return GeneratorConfig.builder()
                    .words(strings(object.getJSONArray("words")))
                    .joiners(strings(object.getJSONArray("joiners")))
                    .maxPermutationLength(object.getInt("max_permutation_length"))
                    .masks(strings(object.getJSONArray("masks")))
                    .numbers(strings(object.getJSONArray("numbers")))
                    .symbols(strings(object.getJSONArray("symbols")))
                    .years(strings(object.getJSONArray("years")))
                    .cases(strings(object.getJSONArray("cases")).stream().map(CaseMode::valueOf).toList())
                    .leetMap(leetMap)
                    .leetMaxExpansions(leet.getInt("max_expansions"))
                    .minLength(object.getInt("min_length"))
                    .maxLength(object.getInt("max_length"))
                    .minEntropy(object.getDouble("min_entropy"))
                    .blacklist(new LinkedHashSet<>(strings(object.getJSONArray("blacklist"))))
                    .maxCount(object.getLong("max_count"))
                    .workerCount(object.getInt("worker_count"))
                    .executionMode(ExecutionMode.valueOf(object.getString("execution_mode")))
                    .build();
        } catch (final JSONException e) {
            throw new ConfigException("Malformed configuration: %s".formatted(e.getMessage()), e);
        }
    }

    private static List<String> strings(final JSONArray array) {
        final List<String> values = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }
}
