package com.verlumen.placement.persistence;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/** Keeps every saved placement in a single JSON array file. */
public final class JsonAssignmentRepository implements AssignmentRepository {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Type RECORD_LIST_TYPE = new TypeToken<List<AssignmentRecord>>() {}.getType();
  private static final Gson GSON =
      new GsonBuilder()
          .registerTypeAdapter(LocalDate.class, new LocalDateAdapter())
          .setPrettyPrinting()
          .create();

  private final Path path;

  public JsonAssignmentRepository(Path path) {
    this.path = path;
  }

  @Override
  public ImmutableList<AssignmentRecord> findByFiscalYear(int fiscalYear) {
    return readAll().stream()
        .filter(record -> record.fiscalYear() == fiscalYear)
        .collect(toImmutableList());
  }

  @Override
  public synchronized int replaceFiscalYear(int fiscalYear, List<AssignmentRecord> records) {
    for (AssignmentRecord record : records) {
      checkArgument(
          record.fiscalYear() == fiscalYear,
          "Record for resident %s belongs to %s, not %s",
          record.residentId(),
          record.fiscalYear(),
          fiscalYear);
    }

    List<AssignmentRecord> kept = new ArrayList<>();
    int deleted = 0;
    for (AssignmentRecord existing : readAll()) {
      if (existing.fiscalYear() == fiscalYear) {
        deleted++;
      } else {
        kept.add(existing);
      }
    }
    kept.addAll(records);
    write(kept);
    logger.atInfo().log(
        "Saved %d assignments for %d (replaced %d) to %s",
        records.size(), fiscalYear, deleted, path);
    return records.size();
  }

  private List<AssignmentRecord> readAll() {
    if (!Files.exists(path)) {
      return List.of();
    }
    String json;
    try {
      json = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read assignments from: " + path, e);
    }
    List<AssignmentRecord> records = GSON.fromJson(json, RECORD_LIST_TYPE);
    return records == null ? List.of() : records;
  }

  private void write(List<AssignmentRecord> records) {
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(path, GSON.toJson(records, RECORD_LIST_TYPE), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write assignments to: " + path, e);
    }
  }

  /** Stores dates as ISO-8601 strings. */
  private static class LocalDateAdapter
      implements JsonDeserializer<LocalDate>, JsonSerializer<LocalDate> {
    @Override
    public LocalDate deserialize(
        JsonElement json, Type typeOfT, JsonDeserializationContext context)
        throws JsonParseException {
      try {
        return LocalDate.parse(json.getAsString());
      } catch (DateTimeParseException e) {
        throw new JsonParseException("Invalid date: " + json, e);
      }
    }

    @Override
    public JsonElement serialize(
        LocalDate src, Type typeOfSrc, JsonSerializationContext context) {
      return new JsonPrimitive(src.toString());
    }
  }
}
