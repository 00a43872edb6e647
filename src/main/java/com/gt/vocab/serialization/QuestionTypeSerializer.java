package com.gt.vocab.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.vocab.model.QuestionType;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class QuestionTypeSerializer extends JsonSerializer<QuestionType> {
    @Override
    public void serialize(QuestionType questionType, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(questionType.getWireName());
    }
}
