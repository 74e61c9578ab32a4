/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


package io.nosqlbench.hmmix.checkpoint;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.Strictness;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.nosqlbench.hmmix.hmm.ComponentHmm;
import io.nosqlbench.hmmix.hmm.ExponentialHmm;
import io.nosqlbench.hmmix.hmm.GaussianHmm;
import io.nosqlbench.hmmix.hmm.MultinomialHmm;
import io.nosqlbench.hmmix.hmm.PoissonHmm;
import io.nosqlbench.hmmix.model.EmissionFamily;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * Gson TypeAdapterFactory for polymorphic {@link ComponentHmm} serialization.
 *
 * <pre>{@code
 *  SERIALIZE                              DESERIALIZE
 *  ─────────                              ───────────
 *  PoissonHmm                             { "type": "poisson", ... }
 *        │                                         │
 *        ▼                                         ▼
 *  1. Get @EmissionType("poisson")        1. Read "type" field
 *  2. Serialize the class's fields        2. Look up the registered class
 *  3. Put "type" first                    3. Deserialize with its delegate
 *        │                                         │
 *        ▼                                         ▼
 *  {"type":"poisson","n_states":2,...}    PoissonHmm
 * }</pre>
 *
 * <p>Both directions go through a lenient intermediate string so that
 * non-finite values survive the trip.
 *
 * @see EmissionType
 * @see HmmixGsonConfig
 */
public final class ComponentHmmTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends ComponentHmm>> typeToClass = new HashMap<>();
    private final Map<Class<? extends ComponentHmm>, String> classToType = new HashMap<>();

    private ComponentHmmTypeAdapterFactory() {
    }

    /**
     * Creates a factory with every emission family registered.
     */
    public static ComponentHmmTypeAdapterFactory create() {
        ComponentHmmTypeAdapterFactory factory = new ComponentHmmTypeAdapterFactory();
        factory.registerType(MultinomialHmm.class);
        factory.registerType(PoissonHmm.class);
        factory.registerType(ExponentialHmm.class);
        factory.registerType(GaussianHmm.class);
        return factory;
    }

    /**
     * Registers an implementation under the name from its {@link EmissionType} annotation.
     *
     * @throws IllegalArgumentException if the annotation is missing, names no emission family,
     *         or the name is already taken
     */
    public void registerType(Class<? extends ComponentHmm> hmmClass) {
        EmissionType annotation = hmmClass.getAnnotation(EmissionType.class);
        if (annotation == null) {
            throw new IllegalArgumentException("Class " + hmmClass.getName() + " has no @EmissionType annotation");
        }
        String typeName = EmissionFamily.fromTypeName(annotation.value()).typeName();
        if (typeToClass.containsKey(typeName)) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " + typeToClass.get(typeName).getName());
        }
        typeToClass.put(typeName, hmmClass);
        classToType.put(hmmClass, typeName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!ComponentHmm.class.isAssignableFrom(type.getRawType())) {
            return null;
        }
        TypeAdapter<JsonElement> elementAdapter = gson.getAdapter(JsonElement.class);

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                String typeName = classToType.get(value.getClass());
                if (typeName == null) {
                    throw new IllegalArgumentException("Unregistered HMM class: " + value.getClass().getName());
                }
                TypeAdapter<T> concreteDelegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    ComponentHmmTypeAdapterFactory.this, TypeToken.get(value.getClass()));

                StringWriter buffer = new StringWriter();
                JsonWriter lenientWriter = new JsonWriter(buffer);
                lenientWriter.setStrictness(Strictness.LENIENT);
                concreteDelegate.write(lenientWriter, value);
                lenientWriter.close();

                JsonObject fields = JsonParser.parseString(buffer.toString()).getAsJsonObject();
                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }

                Strictness previous = out.getStrictness();
                out.setStrictness(Strictness.LENIENT);
                try {
                    elementAdapter.write(out, result);
                } finally {
                    out.setStrictness(previous);
                }
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new JsonParseException("Missing '" + TYPE_FIELD + "' field in HMM JSON");
                }
                String typeName = obj.get(TYPE_FIELD).getAsString();
                Class<? extends ComponentHmm> targetClass = typeToClass.get(typeName);
                if (targetClass == null) {
                    throw new JsonParseException(
                        "Unknown HMM type: '" + typeName + "'. Known types: " + typeToClass.keySet());
                }
                if (!type.getRawType().isAssignableFrom(targetClass)) {
                    throw new JsonParseException("Expected " + type.getRawType().getSimpleName()
                        + " but JSON holds type '" + typeName + "'");
                }
                obj.remove(TYPE_FIELD);
                TypeAdapter<? extends ComponentHmm> targetAdapter =
                    gson.getDelegateAdapter(ComponentHmmTypeAdapterFactory.this, TypeToken.get(targetClass));
                JsonReader lenientReader = new JsonReader(new StringReader(obj.toString()));
                lenientReader.setStrictness(Strictness.LENIENT);
                return (T) targetAdapter.read(lenientReader);
            }
        };
    }

    /**
     * Returns the type name registered for {@code hmmClass}, or null.
     */
    public String getTypeName(Class<? extends ComponentHmm> hmmClass) {
        return classToType.get(hmmClass);
    }
}
