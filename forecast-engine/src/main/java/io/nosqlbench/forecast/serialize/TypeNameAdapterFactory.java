package io.nosqlbench.forecast.serialize;

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

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gson adapter factory for one polymorphic engine type, discriminated by a
 * {@code "type"} field holding the {@link TypeName} of the implementation.
 *
 * <pre>{@code
 *  SERIALIZE                               DESERIALIZE
 *  BinomialFamily(40)                      { "type": "binomial", "capacity": 40 }
 *    1. look up @TypeName("binomial")        1. read "type"
 *    2. write the concrete fields            2. look up the registered class
 *    3. put "type" first                     3. read with the concrete adapter
 * }</pre>
 *
 * <pre>{@code
 * Gson gson = new GsonBuilder()
 *     .registerTypeAdapterFactory(TypeNameAdapterFactory.of(EventProfile.class)
 *         .registerType(BoxProfile.class)
 *         .registerType(GaussianProfile.class))
 *     .create();
 * }</pre>
 *
 * @param <B> the polymorphic base type
 */
public final class TypeNameAdapterFactory<B> implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Class<B> baseType;
    private final Map<String, Class<? extends B>> typeToClass = new LinkedHashMap<>();
    private final Map<Class<? extends B>, String> classToType = new LinkedHashMap<>();

    private TypeNameAdapterFactory(Class<B> baseType) {
        this.baseType = baseType;
    }

    public static <B> TypeNameAdapterFactory<B> of(Class<B> baseType) {
        return new TypeNameAdapterFactory<>(baseType);
    }

    /**
     * Registers an implementation under the name of its {@link TypeName} annotation.
     *
     * @param type the implementation class
     * @return this factory
     * @throws IllegalArgumentException when the class is not annotated or the name is taken
     */
    public TypeNameAdapterFactory<B> registerType(Class<? extends B> type) {
        TypeName annotation = type.getAnnotation(TypeName.class);
        if (annotation == null) {
            throw new IllegalArgumentException("Class " + type.getName() + " has no @TypeName annotation");
        }
        String name = annotation.value();
        if (typeToClass.containsKey(name)) {
            throw new IllegalArgumentException("Type '" + name + "' is already registered to "
                + typeToClass.get(name).getName());
        }
        typeToClass.put(name, type);
        classToType.put(type, name);
        return this;
    }

    public String getTypeName(Class<? extends B> type) {
        return classToType.get(type);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!baseType.isAssignableFrom(type.getRawType())) {
            return null;
        }
        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                String name = classToType.get(value.getClass());
                if (name == null) {
                    throw new JsonParseException("Unregistered " + baseType.getSimpleName() + " type: "
                        + value.getClass().getName());
                }
                TypeAdapter<T> delegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    TypeNameAdapterFactory.this, TypeToken.get(value.getClass()));

                StringWriter buffer = new StringWriter();
                JsonWriter lenientWriter = new JsonWriter(buffer);
                lenientWriter.setLenient(true);
                delegate.write(lenientWriter, value);
                lenientWriter.close();

                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, name);
                for (Map.Entry<String, JsonElement> entry : JsonParser.parseString(buffer.toString())
                    .getAsJsonObject().entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }
                boolean wasLenient = out.isLenient();
                out.setLenient(true);
                try {
                    Streams.write(result, out);
                } finally {
                    out.setLenient(wasLenient);
                }
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                JsonObject object = element.getAsJsonObject();
                if (!object.has(TYPE_FIELD)) {
                    throw new JsonParseException("Missing '" + TYPE_FIELD + "' field in " + baseType.getSimpleName()
                        + " JSON: " + object);
                }
                String name = object.get(TYPE_FIELD).getAsString();
                Class<? extends B> target = typeToClass.get(name);
                if (target == null) {
                    throw new JsonParseException("Unknown " + baseType.getSimpleName() + " type: '" + name
                        + "'. Known types: " + typeToClass.keySet());
                }
                object.remove(TYPE_FIELD);
                TypeAdapter<? extends B> delegate = gson.getDelegateAdapter(TypeNameAdapterFactory.this,
                    TypeToken.get(target));
                JsonReader lenientReader = new JsonReader(new StringReader(object.toString()));
                lenientReader.setLenient(true);
                return (T) delegate.read(lenientReader);
            }
        };
    }
}
