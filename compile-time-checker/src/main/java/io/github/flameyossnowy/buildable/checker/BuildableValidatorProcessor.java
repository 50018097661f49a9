package io.github.flameyossnowy.buildable.checker;

import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.ParenthesizedTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.TypeCastTree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.Trees;

import javax.annotation.processing.*;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import javax.lang.model.type.*;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import java.util.List;
import java.util.Set;

/**
 * Rejects, at compile time, types that claim the {@code Build} capability without satisfying it.
 */
@SupportedSourceVersion(SourceVersion.RELEASE_17)
@SupportedAnnotationTypes(BuildableValidatorProcessor.BUILDABLE)
@SupportedOptions(BuildableValidatorProcessor.VERBOSE_OPTION)
public class BuildableValidatorProcessor extends AbstractProcessor {
    static final String BUILDABLE = "io.github.flameyossnowy.buildable.annotations.Buildable";
    static final String BUILD = "io.github.flameyossnowy.buildable.Build";
    static final String VERBOSE_OPTION = "buildable.verbose";

    private static final Set<Modifier> WITNESS_MODIFIERS = Set.of(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL);

    private Messager messager;
    private Types types;
    private Trees trees;
    private boolean verbose;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.messager = processingEnv.getMessager();
        this.types = processingEnv.getTypeUtils();
        this.verbose = Boolean.parseBoolean(processingEnv.getOptions().get(VERBOSE_OPTION));
        try {
            this.trees = Trees.instance(processingEnv);
        } catch (IllegalArgumentException e) {
            messager.printMessage(Diagnostic.Kind.WARNING,
                "Source trees are not available, null Build witnesses will not be detected: " + e.getMessage());
        }
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        TypeElement buildable = processingEnv.getElementUtils().getTypeElement(BUILDABLE);
        TypeElement build = processingEnv.getElementUtils().getTypeElement(BUILD);
        if (buildable == null || build == null) return false;

        Set<? extends Element> elements = roundEnv.getElementsAnnotatedWith(buildable);
        if (elements.isEmpty()) return false;

        for (Element element : elements) {
            if (!(element instanceof TypeElement typeElement)) continue;
            if (validate(typeElement, build) && verbose) {
                messager.printMessage(Diagnostic.Kind.NOTE,
                    "@Buildable " + typeElement.getQualifiedName() + " satisfies capability Build",
                    typeElement);
            }
        }

        return true;
    }

    private boolean validate(TypeElement typeElement, TypeElement build) {
        ElementKind kind = typeElement.getKind();
        if (kind == ElementKind.INTERFACE || kind == ElementKind.ANNOTATION_TYPE
            || typeElement.getModifiers().contains(Modifier.ABSTRACT)) {
            error(typeElement, "@Buildable " + typeElement.getSimpleName() + " must be a concrete type");
            return false;
        }

        List<VariableElement> witnesses = typeElement.getEnclosedElements().stream()
            .filter(e -> e.getKind() == ElementKind.FIELD)
            .map(VariableElement.class::cast)
            .filter(field -> isBuild(field.asType(), build))
            .toList();

        if (witnesses.isEmpty()) {
            error(typeElement, "@Buildable " + typeElement.getSimpleName()
                + " does not satisfy capability Build: no Build<" + typeElement.getSimpleName() + "> witness declared");
            return false;
        }

        if (witnesses.size() > 1) {
            for (VariableElement extra : witnesses.subList(1, witnesses.size())) {
                error(extra, "@Buildable " + typeElement.getSimpleName() + " declares more than one Build witness");
            }
            return false;
        }

        return checkWitness(typeElement, witnesses.get(0));
    }

    private boolean checkWitness(TypeElement owner, VariableElement witness) {
        DeclaredType declaredType = (DeclaredType) witness.asType();
        if (declaredType.getTypeArguments().isEmpty()) {
            error(witness, "Build witness " + witness.getSimpleName() + " of " + owner.getSimpleName() + " is a raw type");
            return false;
        }

        boolean valid = true;
        TypeMirror built = declaredType.getTypeArguments().get(0);
        if (!types.isSameType(types.erasure(built), types.erasure(owner.asType()))) {
            error(witness, "Build witness " + witness.getSimpleName() + " must build "
                + owner.getSimpleName() + ", found " + built);
            valid = false;
        }

        if (!witness.getModifiers().containsAll(WITNESS_MODIFIERS)) {
            error(witness, "Build witness " + witness.getSimpleName() + " of " + owner.getSimpleName()
                + " must be public static final");
            valid = false;
        }

        if (isInitializedToNull(witness)) {
            error(witness, "Build witness " + witness.getSimpleName() + " of " + owner.getSimpleName()
                + " must not be null");
            valid = false;
        }
        return valid;
    }

    private boolean isInitializedToNull(VariableElement witness) {
        if (trees == null) return false;
        if (!(trees.getTree(witness) instanceof VariableTree variable)) return false;

        ExpressionTree initializer = variable.getInitializer();
        while (initializer != null) {
            if (initializer instanceof ParenthesizedTree parenthesized) {
                initializer = parenthesized.getExpression();
            } else if (initializer instanceof TypeCastTree cast) {
                initializer = cast.getExpression();
            } else {
                return initializer.getKind() == Tree.Kind.NULL_LITERAL;
            }
        }
        return false;
    }

    private boolean isBuild(TypeMirror type, TypeElement build) {
        if (type.getKind() != TypeKind.DECLARED) return false;
        return types.isSameType(types.erasure(type), types.erasure(build.asType()));
    }

    private void error(Element target, String message) {
        messager.printMessage(Diagnostic.Kind.ERROR, message, target);
    }
}
