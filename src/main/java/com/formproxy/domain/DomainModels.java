package com.formproxy.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public class DomainModels {
    public record Submission(String submissionId,
                             String submissionTime,
                             String lastUpdatedAt,
                             List<Question> questions,
                             JsonNode raw) {
        public Optional<Question> question(String id) {
            return questions.stream().filter(q -> q.id().equals(id)).findFirst();
        }
    }

    public record Question(String id, String name, QuestionType type, FieldValue value) {}

    public record FilterClause(String id, FilterCondition condition, FieldValue value) {}

    public sealed interface FieldValue permits Absent, TextValue, NumberValue {
        static FieldValue absent() {
            return Absent.INSTANCE;
        }
    }

    public record Absent() implements FieldValue {
        private static final Absent INSTANCE = new Absent();
    }

    public record TextValue(String value) implements FieldValue {}

    public record NumberValue(double value) implements FieldValue {}

    public enum QuestionCategory { NUMERIC, DATE_TIME, CHOICE, TEXT, MEDIA, SPECIAL }

    public enum QuestionType {
        SHORT_ANSWER("ShortAnswer", QuestionCategory.TEXT),
        LONG_ANSWER("LongAnswer", QuestionCategory.TEXT),
        NUMBER_INPUT("NumberInput", QuestionCategory.NUMERIC),
        EMAIL_INPUT("EmailInput", QuestionCategory.TEXT),
        PASSWORD("Password", QuestionCategory.TEXT),
        URL_INPUT("URLInput", QuestionCategory.TEXT),
        CURRENCY_INPUT("CurrencyInput", QuestionCategory.TEXT),

        CHECKBOX("Checkbox", QuestionCategory.CHOICE),
        CHECKBOXES("Checkboxes", QuestionCategory.CHOICE),
        DROPDOWN("Dropdown", QuestionCategory.CHOICE),
        MULTI_SELECT("MultiSelect", QuestionCategory.CHOICE),
        MULTIPLE_CHOICE("MultipleChoice", QuestionCategory.CHOICE),

        DATE_PICKER("DatePicker", QuestionCategory.DATE_TIME),
        DATE_RANGE("DateRange", QuestionCategory.DATE_TIME),
        DATE_TIME_PICKER("DateTimePicker", QuestionCategory.DATE_TIME),
        TIME_PICKER("TimePicker", QuestionCategory.DATE_TIME),

        AUDIO_RECORDING("AudioRecording", QuestionCategory.MEDIA),
        FILE_UPLOAD("FileUpload", QuestionCategory.MEDIA),
        IMAGE_PICKER("ImagePicker", QuestionCategory.MEDIA),

        ADDRESS("Address", QuestionCategory.SPECIAL),
        CALCOM("Calcom", QuestionCategory.SPECIAL),
        CALENDLY("Calendly", QuestionCategory.SPECIAL),
        CAPTCHA("Captcha", QuestionCategory.SPECIAL),
        COLOR_PICKER("ColorPicker", QuestionCategory.SPECIAL),
        LOCATION_COORDINATES("LocationCoordinates", QuestionCategory.SPECIAL),
        MATRIX("Matrix", QuestionCategory.SPECIAL),
        OPINION_SCALE("OpinionScale", QuestionCategory.SPECIAL),
        PAYMENT("Payment", QuestionCategory.SPECIAL),
        PHONE_NUMBER("PhoneNumber", QuestionCategory.SPECIAL),
        RANKING("Ranking", QuestionCategory.SPECIAL),
        RECORD_PICKER("RecordPicker", QuestionCategory.SPECIAL),
        SIGNATURE("Signature", QuestionCategory.SPECIAL),
        SLIDER("Slider", QuestionCategory.SPECIAL),
        STAR_RATING("StarRating", QuestionCategory.SPECIAL),
        SWITCH("Switch", QuestionCategory.SPECIAL),

        UNRECOGNIZED(null, QuestionCategory.SPECIAL);

        private static final Map<String, QuestionType> BY_TAG = Arrays.stream(values())
                .filter(t -> t.tag != null)
                .collect(Collectors.toMap(t -> t.tag, Function.identity()));

        private final String tag;
        private final QuestionCategory category;

        QuestionType(String tag, QuestionCategory category) {
            this.tag = tag;
            this.category = category;
        }

        public String tag() {
            return tag;
        }

        public QuestionCategory category() {
            return category;
        }

        public static QuestionType fromTag(String tag) {
            if (tag == null) return UNRECOGNIZED;
            return BY_TAG.getOrDefault(tag, UNRECOGNIZED);
        }
    }

    public enum FilterCondition {
        EQUALS("equals"),
        DOES_NOT_EQUAL("does_not_equal"),
        GREATER_THAN("greater_than"),
        LESS_THAN("less_than");

        private final String wireName;

        FilterCondition(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Optional<FilterCondition> fromWireName(String name) {
            return Arrays.stream(values()).filter(c -> c.wireName.equals(name)).findFirst();
        }

        public static List<String> wireNames() {
            return Arrays.stream(values()).map(FilterCondition::wireName).toList();
        }
    }
}
