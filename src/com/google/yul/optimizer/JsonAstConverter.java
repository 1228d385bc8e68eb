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

package com.google.yul.optimizer;

import com.google.gson.stream.JsonWriter;
import com.google.yul.ir.Node;
import java.io.IOException;
import java.io.StringWriter;
import org.jspecify.annotations.Nullable;

/**
 * Exports a Yul tree as JSON. Every node becomes an object with a {@code nodeType} such as {@code
 * YulBlock} or {@code YulFunctionCall} and a {@code src} location of the form {@code line:column}
 * when the node came from source.
 */
public final class JsonAstConverter {

  private final JsonWriter jsonWriter;

  private JsonAstConverter(JsonWriter jsonWriter) {
    this.jsonWriter = jsonWriter;
  }

  /** Returns the tree rooted at {@code root} as indented JSON. */
  public static String toJson(Node root) {
    StringWriter out = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(out)) {
      jsonWriter.setIndent("  ");
      new JsonAstConverter(jsonWriter).write(root);
      jsonWriter.flush();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    return out.toString();
  }

  private void write(Node n) throws IOException {
    jsonWriter.beginObject();
    switch (n.getToken()) {
      case BLOCK:
        begin("YulBlock", n);
        jsonWriter.name("statements");
        writeChildren(n, null);
        break;
      case FUNCTION:
        begin("YulFunctionDefinition", n);
        jsonWriter.name("name").value(n.getFirstChild().getString());
        jsonWriter.name("parameters");
        writeTypedNames(n.getSecondChild(), null);
        jsonWriter.name("returnVariables");
        writeTypedNames(n.getChildAtIndex(2), null);
        jsonWriter.name("body");
        write(n.getLastChild());
        break;
      case LET:
        {
          begin("YulVariableDeclaration", n);
          jsonWriter.name("variables");
          writeTypedNames(n, n.getLastChild());
          jsonWriter.name("value");
          Node value = NodeUtil.getLetValue(n);
          if (value == null) {
            jsonWriter.nullValue();
          } else {
            write(value);
          }
          break;
        }
      case ASSIGN:
        begin("YulAssignment", n);
        jsonWriter.name("variableNames");
        writeChildren(n, n.getLastChild());
        jsonWriter.name("value");
        write(n.getLastChild());
        break;
      case EXPR_RESULT:
        begin("YulExpressionStatement", n);
        jsonWriter.name("expression");
        write(n.getFirstChild());
        break;
      case IF:
        begin("YulIf", n);
        jsonWriter.name("condition");
        write(n.getFirstChild());
        jsonWriter.name("body");
        write(n.getLastChild());
        break;
      case SWITCH:
        begin("YulSwitch", n);
        jsonWriter.name("expression");
        write(n.getFirstChild());
        jsonWriter.name("cases");
        jsonWriter.beginArray();
        for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
          write(c);
        }
        jsonWriter.endArray();
        break;
      case CASE:
      case DEFAULT_CASE:
        begin("YulCase", n);
        jsonWriter.name("value");
        if (n.isCase()) {
          write(n.getFirstChild());
        } else {
          jsonWriter.value("default");
        }
        jsonWriter.name("body");
        write(n.getLastChild());
        break;
      case FOR:
        begin("YulForLoop", n);
        jsonWriter.name("pre");
        write(n.getFirstChild());
        jsonWriter.name("condition");
        write(n.getSecondChild());
        jsonWriter.name("post");
        write(n.getChildAtIndex(2));
        jsonWriter.name("body");
        write(n.getLastChild());
        break;
      case BREAK:
        begin("YulBreak", n);
        break;
      case CONTINUE:
        begin("YulContinue", n);
        break;
      case LEAVE:
        begin("YulLeave", n);
        break;
      case CALL:
        begin("YulFunctionCall", n);
        jsonWriter.name("functionName");
        write(n.getFirstChild());
        jsonWriter.name("arguments");
        jsonWriter.beginArray();
        for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
          write(arg);
        }
        jsonWriter.endArray();
        break;
      case NAME:
        begin("YulIdentifier", n);
        jsonWriter.name("name").value(n.getString());
        break;
      case NUMBER:
        writeLiteral(n, "number", n.getString());
        break;
      case STRING:
        {
          String spelling = n.getString();
          writeLiteral(n, "string", spelling.substring(1, spelling.length() - 1));
          break;
        }
      case TRUE:
        writeLiteral(n, "bool", "true");
        break;
      case FALSE:
        writeLiteral(n, "bool", "false");
        break;
      default:
        throw new IllegalStateException("Unexpected node " + n);
    }
    jsonWriter.endObject();
  }

  private void begin(String nodeType, Node n) throws IOException {
    jsonWriter.name("nodeType").value(nodeType);
    if (n.getLineno() > 0) {
      jsonWriter.name("src").value(n.getLineno() + ":" + n.getCharno());
    }
  }

  private void writeLiteral(Node n, String kind, String value) throws IOException {
    begin("YulLiteral", n);
    jsonWriter.name("kind").value(kind);
    jsonWriter.name("value").value(value);
    jsonWriter.name("type").value("");
  }

  /** Writes the children of {@code n} before {@code end} as an array. */
  private void writeChildren(Node n, @Nullable Node end) throws IOException {
    jsonWriter.beginArray();
    for (Node child = n.getFirstChild(); child != end; child = child.getNext()) {
      write(child);
    }
    jsonWriter.endArray();
  }

  private void writeTypedNames(Node n, @Nullable Node end) throws IOException {
    jsonWriter.beginArray();
    for (Node name = n.getFirstChild(); name != end; name = name.getNext()) {
      jsonWriter.beginObject();
      begin("YulTypedName", name);
      jsonWriter.name("name").value(name.getString());
      jsonWriter.name("type").value("");
      jsonWriter.endObject();
    }
    jsonWriter.endArray();
  }
}
