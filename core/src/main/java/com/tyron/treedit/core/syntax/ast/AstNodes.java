package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.InsertPosition;
import com.tyron.treedit.core.syntax.InvalidStructureException;
import com.tyron.treedit.core.syntax.SyntaxAlgo;
import com.tyron.treedit.core.syntax.SyntaxElement;
import com.tyron.treedit.core.syntax.SyntaxNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Casting between untyped syntax nodes and typed categories, and typed wrappers around {@link SyntaxAlgo}.
 * <p>
 * The wrappers re-cast the edited node to the category of the input and fail with
 * {@link InvalidStructureException} when it no longer fits.
 */
public final class AstNodes {

    private static final Map<Class<? extends AstNode>, Function<SyntaxNode, ? extends AstNode>> CASTERS = new HashMap<>();

    static {
        register(SourceFile.class, SourceFile::cast);
        register(StructDef.class, StructDef::cast);
        register(RecordFieldList.class, RecordFieldList::cast);
        register(RecordField.class, RecordField::cast);
        register(ImplBlock.class, ImplBlock::cast);
        register(ItemList.class, ItemList::cast);
        register(ImplItem.class, ImplItem::cast);
        register(FnDef.class, FnDef::cast);
        register(Block.class, Block::cast);
        register(TypeParamList.class, TypeParamList::cast);
        register(TypeParam.class, TypeParam::cast);
        register(TypeBoundList.class, TypeBoundList::cast);
        register(Attr.class, Attr::cast);
        register(Name.class, Name::cast);
    }

    private AstNodes() {
    }

    private static <N extends AstNode> void register(Class<N> type, Function<SyntaxNode, N> caster) {
        CASTERS.put(type, caster);
    }

    @Nullable
    public static <N extends AstNode> N cast(@NotNull Class<N> type, @NotNull SyntaxNode syntax) {
        Function<SyntaxNode, ? extends AstNode> caster = CASTERS.get(type);
        if (caster == null) {
            throw new IllegalArgumentException("unknown syntax category " + type.getName());
        }
        return type.cast(caster.apply(syntax));
    }

    @NotNull
    public static <N extends AstNode> N castOrThrow(@NotNull Class<N> type, @NotNull SyntaxNode syntax) {
        N cast = cast(type, syntax);
        if (cast == null) {
            throw new InvalidStructureException(syntax.getKind() + " `" + syntax.getText() + "` is not a valid " + type.getSimpleName());
        }
        return cast;
    }

    /**
     * Re-casts {@code syntax} to the same category as {@code prototype}.
     */
    @NotNull
    @SuppressWarnings("unchecked")
    public static <N extends AstNode> N recast(@NotNull N prototype, @NotNull SyntaxNode syntax) {
        return castOrThrow((Class<N>) prototype.getClass(), syntax);
    }

    @NotNull
    public static <N extends AstNode> N insertChildren(@NotNull N parent,
                                                       @NotNull InsertPosition<SyntaxElement> position,
                                                       @NotNull List<? extends SyntaxElement> toInsert) {
        return recast(parent, SyntaxAlgo.insertChildren(parent.syntax(), position, toInsert));
    }

    @NotNull
    public static <N extends AstNode> N replaceChildren(@NotNull N parent,
                                                        @NotNull SyntaxElement first,
                                                        @NotNull SyntaxElement last,
                                                        @NotNull List<? extends SyntaxElement> toInsert) {
        return recast(parent, SyntaxAlgo.replaceChildren(parent.syntax(), first, last, toInsert));
    }

    @NotNull
    public static <N extends AstNode> N replaceDescendants(@NotNull N root,
                                                           @NotNull Map<? extends SyntaxElement, ? extends SyntaxElement> replacements) {
        return recast(root, SyntaxAlgo.replaceDescendants(root.syntax(), replacements));
    }

    /**
     * @return every node of the given category in the subtree of {@code root}, in document order
     */
    @NotNull
    public static <N extends AstNode> List<N> descendants(@NotNull SyntaxNode root, @NotNull Class<N> type) {
        Objects.requireNonNull(root, "root");
        List<N> result = new ArrayList<>();
        for (SyntaxElement element : root.descendantsWithTokens()) {
            if (element instanceof SyntaxNode node) {
                N cast = cast(type, node);
                if (cast != null) {
                    result.add(cast);
                }
            }
        }
        return result;
    }

    @Nullable
    public static <N extends AstNode> N firstDescendant(@NotNull SyntaxNode root, @NotNull Class<N> type) {
        List<N> all = descendants(root, type);
        return all.isEmpty() ? null : all.get(0);
    }
}
