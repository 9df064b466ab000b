package io.github.joke.wireform.processor;

import static java.util.stream.Collectors.toList;
import static javax.lang.model.element.Modifier.STATIC;

import io.github.joke.wireform.ProtoConvert;
import io.github.joke.wireform.ProtoField;
import io.github.joke.wireform.di.RoundScoped;
import io.github.joke.wireform.model.AggregateDescriptor;
import io.github.joke.wireform.model.DirectiveToken;
import io.github.joke.wireform.model.EnumDescriptor;
import io.github.joke.wireform.model.FieldDescriptor;
import io.github.joke.wireform.stage.DirectiveTokenizer;
import io.github.joke.wireform.stage.Names;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.inject.Inject;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;
import org.jspecify.annotations.Nullable;

/**
 * Reads annotated domain types into descriptors. Only annotation members that are explicitly
 * assigned become directive tokens.
 */
@RoundScoped
public class DescriptorExtractor {

    private final Elements elements;
    private final DirectiveTokenizer tokenizer;

    @Inject
    DescriptorExtractor(Elements elements, DirectiveTokenizer tokenizer) {
        this.elements = elements;
        this.tokenizer = tokenizer;
    }

    public AggregateDescriptor extractAggregate(TypeElement type) {
        String packageName = packageName(type);
        String simpleName = simpleName(type);
        List<FieldDescriptor> fields = instanceFields(type).stream()
                .map(field -> new FieldDescriptor(
                        field.getSimpleName().toString(),
                        field.asType().toString(),
                        fieldTokens(field, simpleName),
                        simpleName,
                        accessorOf(type, field)))
                .collect(toList());
        return new AggregateDescriptor(packageName, simpleName, aggregateTokens(type), fields);
    }

    public EnumDescriptor extractEnum(TypeElement type, List<String> wireVariants) {
        List<String> variants = type.getEnclosedElements().stream()
                .filter(element -> element.getKind() == ElementKind.ENUM_CONSTANT)
                .map(element -> element.getSimpleName().toString())
                .collect(toList());
        return new EnumDescriptor(packageName(type), simpleName(type), aggregateTokens(type), variants, wireVariants);
    }

    public List<String> enumConstants(String canonicalName) {
        TypeElement type = elements.getTypeElement(canonicalName);
        if (type == null || type.getKind() != ElementKind.ENUM) {
            return List.of();
        }
        return type.getEnclosedElements().stream()
                .filter(element -> element.getKind() == ElementKind.ENUM_CONSTANT)
                .map(element -> element.getSimpleName().toString())
                .collect(toList());
    }

    public List<DirectiveToken> aggregateTokens(TypeElement type) {
        List<DirectiveToken> tokens = new ArrayList<>();
        String aggregate = simpleName(type);
        AnnotationMirror mirror = findAnnotation(type, ProtoConvert.class.getCanonicalName());
        if (mirror == null) {
            return tokens;
        }
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry :
                mirror.getElementValues().entrySet()) {
            Object value = entry.getValue().getValue();
            switch (entry.getKey().getSimpleName().toString()) {
                case "namespace":
                    tokens.add(DirectiveToken.literal("namespace", (String) value));
                    break;
                case "wireName":
                    tokens.add(DirectiveToken.literal("wire_name", (String) value));
                    break;
                case "errorType":
                    tokens.add(DirectiveToken.identifier("error_type", typeName(value)));
                    break;
                case "errorFn":
                    tokens.add(DirectiveToken.literal("error_fn", (String) value));
                    break;
                case "directives":
                    tokens.addAll(tokenizer.tokenize((String) value, aggregate, null));
                    break;
                default:
                    break;
            }
        }
        return tokens;
    }

    List<DirectiveToken> fieldTokens(VariableElement field, String aggregate) {
        List<DirectiveToken> tokens = new ArrayList<>();
        AnnotationMirror mirror = findAnnotation(field, ProtoField.class.getCanonicalName());
        if (mirror == null) {
            return tokens;
        }
        String fieldName = field.getSimpleName().toString();
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry :
                mirror.getElementValues().entrySet()) {
            Object value = entry.getValue().getValue();
            String member = entry.getKey().getSimpleName().toString();
            switch (member) {
                case "ignore":
                case "transparent":
                case "optional":
                case "required":
                    if (Boolean.TRUE.equals(value)) {
                        tokens.add(DirectiveToken.flag(member));
                    }
                    break;
                case "useDefault":
                    if (Boolean.TRUE.equals(value)) {
                        tokens.add(DirectiveToken.flag("default"));
                    }
                    break;
                case "expect":
                    String mode = ((VariableElement) value).getSimpleName().toString();
                    if (!"NONE".equals(mode)) {
                        tokens.add(DirectiveToken.parenthesized("expect", mode.toLowerCase(Locale.ROOT)));
                    }
                    break;
                case "defaultFn":
                    tokens.add(DirectiveToken.literal("default", (String) value));
                    break;
                case "rename":
                case "fromWireFn":
                case "toWireFn":
                case "errorFn":
                    tokens.add(DirectiveToken.literal(Names.snakeCase(member), (String) value));
                    break;
                case "errorType":
                    tokens.add(DirectiveToken.identifier("error_type", typeName(value)));
                    break;
                case "directives":
                    tokens.addAll(tokenizer.tokenize((String) value, aggregate, fieldName));
                    break;
                default:
                    break;
            }
        }
        return tokens;
    }

    public static List<VariableElement> instanceFields(TypeElement type) {
        return ElementFilter.fieldsIn(type.getEnclosedElements()).stream()
                .filter(field -> !field.getModifiers().contains(STATIC))
                .collect(toList());
    }

    /** {@code name()} when declared (records), else {@code isName()} for {@code boolean}, else {@code getName()}. */
    public static String accessorOf(TypeElement type, VariableElement field) {
        String name = field.getSimpleName().toString();
        if (type.getKind() == ElementKind.RECORD) {
            return name;
        }
        boolean declared = ElementFilter.methodsIn(type.getEnclosedElements()).stream()
                .anyMatch(method -> method.getSimpleName().contentEquals(name) && method.getParameters().isEmpty());
        if (declared) {
            return name;
        }
        String prefix = field.asType().getKind() == TypeKind.BOOLEAN ? "is" : "get";
        return prefix + Names.capitalize(name);
    }

    private String packageName(TypeElement type) {
        return elements.getPackageOf(type).getQualifiedName().toString();
    }

    static String simpleName(TypeElement type) {
        Deque<String> names = new ArrayDeque<>();
        Element current = type;
        while (current instanceof TypeElement) {
            names.addFirst(current.getSimpleName().toString());
            current = current.getEnclosingElement();
        }
        return String.join(".", names);
    }

    private static String typeName(Object value) {
        if (value instanceof DeclaredType) {
            return ((TypeElement) ((DeclaredType) value).asElement()).getQualifiedName().toString();
        }
        return String.valueOf(value);
    }

    private static @Nullable AnnotationMirror findAnnotation(Element element, String annotationName) {
        for (AnnotationMirror mirror : element.getAnnotationMirrors()) {
            TypeElement annotationType = (TypeElement) mirror.getAnnotationType().asElement();
            if (annotationType.getQualifiedName().contentEquals(annotationName)) {
                return mirror;
            }
        }
        return null;
    }
}
