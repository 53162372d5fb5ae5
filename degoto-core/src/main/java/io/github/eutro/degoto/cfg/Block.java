package io.github.eutro.degoto.cfg;

import io.github.eutro.degoto.ext.ExtHolder;
import io.github.eutro.degoto.ir.Stmt;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A basic block of lifted statements.
 * <p>
 * Blocks are values: edits produce new blocks through the {@code copy} methods,
 * which keep the block's exts. Equality and hashing only consider the {@link BlockId},
 * so a graph can swap a block for an edited copy of itself.
 */
public final class Block extends ExtHolder {
    public final long addr;
    public final @Nullable Integer idx;
    private final List<Stmt> statements;

    public Block(long addr, @Nullable Integer idx, List<Stmt> statements) {
        this.addr = addr;
        this.idx = idx;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public Block(long addr, List<Stmt> statements) {
        this(addr, null, statements);
    }

    public Block(long addr, Stmt... statements) {
        this(addr, null, Arrays.asList(statements));
    }

    public BlockId id() {
        return new BlockId(addr, idx);
    }

    public List<Stmt> getStatements() {
        return statements;
    }

    public @Nullable Stmt lastStatement() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    public @Nullable Stmt firstNonLabelStatement() {
        for (Stmt stmt : statements) {
            if (!(stmt instanceof Stmt.Label)) return stmt;
        }
        return null;
    }

    public Block copy(@Nullable Integer newIdx, List<Stmt> newStatements) {
        Block block = new Block(addr, newIdx, newStatements);
        block.copyExtsFrom(this);
        return block;
    }

    public Block copy(List<Stmt> newStatements) {
        return copy(idx, newStatements);
    }

    public Block withIdx(@Nullable Integer newIdx) {
        return copy(newIdx, statements);
    }

    public Block withLastStatement(Stmt stmt) {
        List<Stmt> stmts = new ArrayList<>(statements);
        if (stmts.isEmpty()) {
            stmts.add(stmt);
        } else {
            stmts.set(stmts.size() - 1, stmt);
        }
        return copy(stmts);
    }

    public Block withoutLastStatement() {
        if (statements.isEmpty()) return this;
        return copy(statements.subList(0, statements.size() - 1));
    }

    public String toTargetString() {
        return id().toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        return id().equals(((Block) o).id());
    }

    @Override
    public int hashCode() {
        return id().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Stmt stmt : statements) {
            sb.append(' ').append(stmt).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
