package io.intellixity.keyset.page;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link Page}: writes exactly items, total and nextCursor. */
public final class PageJsonSerializer extends JsonSerializer<Page<?>> {
  @Override
  public void serialize(Page<?> page, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (page == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    g.writeArrayFieldStart("items");
    for (Object item : page.items()) {
      serializers.defaultSerializeValue(item, g);
    }
    g.writeEndArray();

    g.writeNumberField("total", page.total());

    if (page.nextCursor() == null) {
      g.writeNullField("nextCursor");
    } else {
      g.writeStringField("nextCursor", page.nextCursor().token());
    }

    g.writeEndObject();
  }
}
