/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.yul.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node in a Yul tree. Children are kept in a doubly linked sibling list: the first child's
 * {@code previous} points at the last child so appends are O(1), and the last child's {@code
 * next} is null.
 *
 * <p>Every node is owned by at most one parent. Attaching a node that already has a parent is a
 * programming error and fails loudly.
 */
public final class Node {

  private final Token token;

  /** Identifier text for NAME nodes, the source spelling for NUMBER and STRING nodes. */
  private @Nullable String string;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newString(Token token, String str) {
    checkArgument(
        token == Token.NAME || token == Token.NUMBER || token == Token.STRING,
        "%s does not carry a string",
        token);
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public Token getToken() {
    return token;
  }

  public String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public void setString(String str) {
    checkState(string != null, "%s has no string", token);
    this.string = checkNotNull(str);
  }

  // Children

  public boolean hasChildren() {
    return first != null;
  }

  public Node getOnlyChild() {
    checkState(hasOneChild(), "Expected exactly one child: %s", this);
    return first;
  }

  public @Nullable Node getFirstChild() {
    return first;
  }

  public @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public @Nullable Node getNext() {
    return next;
  }

  public @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  /** Gets the ith child, note that this is O(N) where N is the number of children. */
  public Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      checkArgument(n != null, "Child index out of range");
      n = n.next;
      i--;
    }
    checkArgument(n != null, "Child index out of range");
    return n;
  }

  public int getIndexOfChild(Node child) {
    int i = 0;
    for (Node n = first; n != null; n = n.next) {
      if (n == child) {
        return i;
      }
      i++;
    }
    return -1;
  }

  public int getChildCount() {
    int count = 0;
    for (Node n = first; n != null; n = n.next) {
      count++;
    }
    return count;
  }

  public boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public boolean hasXChildren(int x) {
    return getChildCount() == x;
  }

  public boolean isDescendantOf(Node node) {
    for (Node n = parent; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns an iterable over the children. Removing the current child while iterating is not
   * supported; capture {@link #getNext()} first instead.
   */
  public Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node result = current;
            current = current.next;
            return result;
          }
        };
  }

  public void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    if (first == null) {
      child.previous = child;
    } else {
      child.previous = first.previous;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    child.checkDetached();
    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  /**
   * Add all children after {@code node}. If {@code node} is null, add them to the front of this
   * node.
   *
   * @param children first of a list of sibling nodes who have no parent, as returned by {@link
   *     #removeChildren()}
   */
  public void addChildrenAfter(@Nullable Node children, @Nullable Node node) {
    if (children == null) {
      return;
    }
    checkArgument(node == null || node.parent == this);
    checkNotNull(children.previous, children);
    for (Node child = children; child != null; child = child.next) {
      checkArgument(child.parent == null);
      child.parent = this;
    }

    Node lastSibling = children.previous;
    if (node == null) {
      if (first != null) {
        children.previous = first.previous;
        lastSibling.next = first;
        first.previous = lastSibling;
      }
      first = children;
      return;
    }

    Node nodeAfter = node.next;
    lastSibling.next = nodeAfter;
    if (nodeAfter == null) {
      first.previous = lastSibling;
    } else {
      nodeAfter.previous = lastSibling;
    }
    node.next = children;
    children.previous = node;
  }

  /** Inserts this detached node as the next sibling of {@code existing}. */
  /** Inserts this detached node as the previous sibling of {@code existing}. */
  public void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    Node existingParent = existing.parent;
    Node existingPrevious = existing.previous;

    this.parent = existingParent;
    this.next = existing;
    existing.previous = this;
    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
    } else {
      existingPrevious.next = this;
    }
  }

  /** Swaps {@code replacement} and its subtree into the position of {@code this}. */
  public void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    Node existingParent = this.parent;
    Node existingNext = this.next;
    Node existingPrevious = this.previous;

    // The sequence below also has to work when `this` is an only child, which can cause many of
    // the variables to point to the same object.
    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
    } else {
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      existingParent.first.previous = replacement;
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /**
   * Replaces this statement with the children of {@code block}, which is left empty. If the block
   * has no children this statement is simply removed.
   */
  public void replaceWithChildrenOf(Node block) {
    checkAttached();
    Node container = parent;
    Node before = getPrevious();
    detach();
    container.addChildrenAfter(block.removeChildren(), before);
  }

  /** Removes this node from its parent, but retains its subtree. */
  @CanIgnoreReturnValue
  public Node detach() {
    this.checkAttached();

    Node existingParent = this.parent;
    Node existingNext = this.next;
    Node existingPrevious = this.previous;

    this.parent = null;

    if (existingNext == null) {
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
    } else {
      existingPrevious.next = existingNext;
    }

    return this;
  }

  /**
   * Remove all children, but leave them linked to each other.
   *
   * @return The first child node
   */
  @CanIgnoreReturnValue
  public @Nullable Node removeChildren() {
    Node children = first;
    for (Node child = first; child != null; child = child.next) {
      child.parent = null;
    }
    first = null;
    return children;
  }

  /** Removes all children from this node and isolates the children from each other. */
  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  // Cloning and comparison

  @CheckReturnValue
  public Node cloneNode() {
    Node result = new Node(token);
    result.string = string;
    result.lineno = lineno;
    result.charno = charno;
    return result;
  }

  @CheckReturnValue
  public Node cloneTree() {
    Node result = cloneNode();
    Node firstChild = null;
    Node lastChild = null;
    for (Node n2 = first; n2 != null; n2 = n2.next) {
      Node n2clone = n2.cloneTree();
      n2clone.parent = result;
      if (firstChild == null) {
        firstChild = n2clone;
      } else {
        lastChild.next = n2clone;
        n2clone.previous = lastChild;
      }
      lastChild = n2clone;
    }
    if (firstChild != null) {
      firstChild.previous = lastChild;
      result.first = firstChild;
    }
    return result;
  }

  /** Structural equality: same tokens, same strings, same shape. Source positions are ignored. */
  public boolean isEquivalentTo(Node node) {
    if (token != node.token || !Objects.equals(string, node.string)) {
      return false;
    }
    Node a = first;
    Node b = node.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  // Source positions

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  /** Copy the source position from {@code other} onto {@code this}. */
  @CanIgnoreReturnValue
  public Node srcref(Node other) {
    this.lineno = other.lineno;
    this.charno = other.charno;
    return this;
  }

  /** Copies the position of {@code other} to every node in this subtree that has none. */
  @CanIgnoreReturnValue
  public Node srcrefTreeIfMissing(Node other) {
    if (lineno < 0) {
      srcref(other);
    }
    for (Node child = first; child != null; child = child.next) {
      child.srcrefTreeIfMissing(other);
    }
    return this;
  }

  // Token predicates

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public boolean isLet() {
    return token == Token.LET;
  }

  public boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isIf() {
    return token == Token.IF;
  }

  public boolean isCase() {
    return token == Token.CASE;
  }

  public boolean isDefaultCase() {
    return token == Token.DEFAULT_CASE;
  }

  public boolean isFor() {
    return token == Token.FOR;
  }

  public boolean isBreak() {
    return token == Token.BREAK;
  }

  public boolean isContinue() {
    return token == Token.CONTINUE;
  }

  public boolean isLeave() {
    return token == Token.LEAVE;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isLiteral() {
    return token.isLiteral();
  }

  public boolean isNumber() {
    return token == Token.NUMBER;
  }

  public boolean isString() {
    return token == Token.STRING;
  }

  // Debugging

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (lineno >= 0) {
      sb.append(" [").append(lineno).append(':').append(charno).append(']');
    }
    return sb.toString();
  }

  /** Prints the subtree one node per line, indented by depth. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node child = first; child != null; child = child.next) {
      child.appendStringTree(sb, level + 1);
    }
  }
}
