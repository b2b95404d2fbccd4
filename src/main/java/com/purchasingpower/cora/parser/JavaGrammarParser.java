package com.purchasingpower.cora.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.purchasingpower.cora.model.index.EntityType;
import com.purchasingpower.cora.model.index.ReferenceType;
import com.purchasingpower.cora.model.parse.IdentifierUsage;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.model.parse.SyntaxNode;
import com.purchasingpower.cora.model.parse.SyntaxTree;
import com.purchasingpower.cora.util.TextLines;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Java grammar backed by JavaParser.
 *
 * Top-level type declarations become declaration nodes; their methods and member types become
 * child declarations. Calls, constructor invocations and method references are recorded as CALL
 * usages, type names as MENTION usages, imports as IMPORT usages carrying the package path.
 */
@Slf4j
@Component
public class JavaGrammarParser implements GrammarParser {

    @Override
    public Set<Language> supportedLanguages() {
        return Set.of(Language.JAVA);
    }

    @Override
    public SyntaxTree parse(String text, Language language) throws ParseFailedException {
        // JavaParser instances are not thread-safe
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false));
        ParseResult<CompilationUnit> result = parser.parse(text);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .limit(3)
                    .map(p -> p.getVerboseMessage())
                    .collect(Collectors.joining("; "));
            throw new ParseFailedException(language.getId(), problems);
        }

        CompilationUnit unit = result.getResult().get();
        int lineCount = TextLines.of(text).count();
        SyntaxNode.SyntaxNodeBuilder root = SyntaxNode.builder()
                .type("compilation_unit")
                .startLine(1)
                .endLine(Math.max(1, lineCount));

        for (ImportDeclaration importDeclaration : unit.getImports()) {
            root.child(importNode(importDeclaration));
        }
        for (TypeDeclaration<?> type : unit.getTypes()) {
            root.child(typeNode(type));
        }
        return new SyntaxTree(language, root.build(), lineCount);
    }

    private SyntaxNode importNode(ImportDeclaration declaration) {
        int line = beginLine(declaration);
        SyntaxNode.SyntaxNodeBuilder node = SyntaxNode.builder()
                .type("import_declaration")
                .startLine(line)
                .endLine(endLine(declaration, line));
        if (!declaration.isAsterisk()) {
            String qualified = declaration.getNameAsString();
            int lastDot = qualified.lastIndexOf('.');
            String simpleName = qualified.substring(lastDot + 1);
            // static imports name a member, the owning class is the module
            String module = lastDot < 0 ? qualified : qualified.substring(0, lastDot);
            String importPath = declaration.isStatic() ? module : qualified;
            node.usage(new IdentifierUsage(simpleName, ReferenceType.IMPORT, line,
                    importPath.replace('.', '/'), null));
        }
        return node.build();
    }

    private SyntaxNode typeNode(TypeDeclaration<?> type) {
        int start = beginLine(type);
        SyntaxNode.SyntaxNodeBuilder node = SyntaxNode.builder()
                .type(nodeType(type))
                .name(type.getNameAsString())
                .declaration(entityType(type))
                .startLine(start)
                .endLine(endLine(type, start));

        if (type instanceof ClassOrInterfaceDeclaration classDeclaration) {
            classDeclaration.getExtendedTypes().forEach(t -> node.usage(mention(t)));
            classDeclaration.getImplementedTypes().forEach(t -> node.usage(mention(t)));
        }

        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                node.child(typeNode(nested));
            } else {
                node.child(memberNode(member));
            }
        }
        if (type instanceof EnumDeclaration enumDeclaration) {
            enumDeclaration.getEntries().forEach(entry -> usagesOf(entry).forEach(node::usage));
        }
        return node.build();
    }

    private SyntaxNode memberNode(BodyDeclaration<?> member) {
        int start = beginLine(member);
        SyntaxNode.SyntaxNodeBuilder node = SyntaxNode.builder()
                .type(member.getClass().getSimpleName())
                .startLine(start)
                .endLine(endLine(member, start));
        if (member instanceof MethodDeclaration method) {
            node.name(method.getNameAsString()).declaration(EntityType.METHOD);
        }
        usagesOf(member).forEach(node::usage);
        return node.build();
    }

    private List<IdentifierUsage> usagesOf(Node scope) {
        Set<IdentifierUsage> usages = new LinkedHashSet<>();
        for (MethodCallExpr call : scope.findAll(MethodCallExpr.class)) {
            usages.add(IdentifierUsage.of(call.getNameAsString(), ReferenceType.CALL, beginLine(call)));
        }
        for (ObjectCreationExpr creation : scope.findAll(ObjectCreationExpr.class)) {
            usages.add(IdentifierUsage.of(creation.getType().getNameAsString(), ReferenceType.CALL,
                    beginLine(creation)));
        }
        for (MethodReferenceExpr reference : scope.findAll(MethodReferenceExpr.class)) {
            usages.add(IdentifierUsage.of(reference.getIdentifier(), ReferenceType.CALL, beginLine(reference)));
        }
        for (ClassOrInterfaceType type : scope.findAll(ClassOrInterfaceType.class)) {
            if (type.getParentNode().filter(ObjectCreationExpr.class::isInstance).isEmpty()) {
                usages.add(mention(type));
            }
        }
        return List.copyOf(usages);
    }

    private IdentifierUsage mention(ClassOrInterfaceType type) {
        return IdentifierUsage.of(type.getNameAsString(), ReferenceType.MENTION, beginLine(type));
    }

    private static String nodeType(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration c) {
            return c.isInterface() ? "interface_declaration" : "class_declaration";
        }
        if (type instanceof EnumDeclaration) {
            return "enum_declaration";
        }
        if (type instanceof RecordDeclaration) {
            return "record_declaration";
        }
        return "annotation_declaration";
    }

    private static EntityType entityType(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration c) {
            return c.isInterface() ? EntityType.INTERFACE : EntityType.CLASS;
        }
        if (type instanceof EnumDeclaration) {
            return EntityType.ENUM;
        }
        if (type instanceof AnnotationDeclaration) {
            return EntityType.INTERFACE;
        }
        return EntityType.CLASS;
    }

    private static int beginLine(Node node) {
        return node.getBegin().map(p -> p.line).orElse(1);
    }

    private static int endLine(Node node, int fallback) {
        return node.getEnd().map(p -> p.line).orElse(fallback);
    }
}
