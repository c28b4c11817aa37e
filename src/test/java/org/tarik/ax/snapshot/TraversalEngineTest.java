/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
package org.tarik.ax.snapshot;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.ax.adapter.FakeNode;
import org.tarik.ax.adapter.FakeNodeAdapter;
import org.tarik.ax.model.AttributeValue.*;
import org.tarik.ax.model.DocumentNode;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tarik.ax.adapter.FakeNode.node;

class TraversalEngineTest {
    private TraversalEngine<FakeNode> engine;
    private FakeNode application;
    private FakeNode window;
    private FakeNode button;
    private FakeNode textField;

    @BeforeEach
    void setUp() {
        engine = new TraversalEngine<>(new FakeNodeAdapter());
        button = node("button").with("title", "OK").with("role", "Button").withActions("press");
        textField = node("text").with("role", "TextField").with("value", "hello");
        window = node("window").with("title", "Main").with("role", "Window").withChildren(button, textField);
        application = node("app").with("role", "Application").with("title", "App").withChildren(window);
    }

    @Test
    @DisplayName("Captures the whole graph depth-first with IDs starting at 1")
    void capturesWholeGraph() {
        var snapshot = engine.snapshot(application, 5);

        var root = snapshot.document();
        assertThat(root.id()).isEqualTo(1);
        assertThat(root.key()).isEqualTo("element1");
        assertThat(root.children()).extracting(DocumentNode::id).containsExactly(2);
        assertThat(root.children().get(0).children()).extracting(DocumentNode::id).containsExactly(3, 4);

        var handles = snapshot.handles();
        assertThat(handles.ids()).containsExactly(1, 2, 3, 4);
        assertThat(handles.resolve(1)).contains(application);
        assertThat(handles.resolve(3)).contains(button);
        assertThat(handles.resolve(4)).contains(textField);
        assertThat(handles.resolve(5)).isEmpty();
    }

    @Test
    @DisplayName("Mandatory attributes come first in their fixed order")
    void mandatoryAttributesComeFirst() {
        var root = engine.snapshot(application, 0).document();

        assertThat(root.attributes().keySet()).containsExactly("title", "role");
        assertThat(root.attributes().get("title")).isEqualTo(new TextValue("App"));
    }

    @Test
    @DisplayName("Depth 0 captures only the root without children")
    void depthZeroCapturesOnlyRoot() {
        var snapshot = engine.snapshot(application, 0);

        assertThat(snapshot.document().hasChildren()).isFalse();
        assertThat(snapshot.document().toPlainDocument()).isEqualTo(Map.of("element1",
                Map.of("attributes", Map.of("title", "App", "role", "Application"))));
        assertThat(snapshot.handles().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Cyclic graphs terminate and each element is captured once")
    void cyclicGraphTerminates() {
        var first = node("first").with("title", "First");
        var second = node("second").with("title", "Second").with("linked", first).withChildren(first);
        first.withChildren(second);

        var snapshot = engine.snapshot(first, 10);

        assertThat(snapshot.handles().size()).isEqualTo(2);
        var secondNode = snapshot.document().children().get(0);
        assertThat(secondNode.hasChildren()).isFalse();
        assertThat(secondNode.attributes()).doesNotContainKey("linked");
    }

    @Test
    @DisplayName("Element reachable through several parents is captured once, under the first one")
    void sharedChildIsCapturedOnce() {
        var shared = node("shared").with("title", "Shared");
        var left = node("left").with("title", "Left").withChildren(shared);
        var right = node("right").with("title", "Right").withChildren(shared);
        var root = node("root").with("title", "Root").withChildren(left, right);

        var snapshot = engine.snapshot(root, 5);

        var children = snapshot.document().children();
        assertThat(snapshot.handles().size()).isEqualTo(4);
        assertThat(snapshot.handles().ids()).filteredOn(id -> snapshot.handles().resolve(id).orElseThrow() == shared)
                .containsExactly(3);
        assertThat(children).extracting(DocumentNode::id).containsExactly(2, 4);
        assertThat(children.get(0).children()).extracting(DocumentNode::id).containsExactly(3);
        assertThat(children.get(1).hasChildren()).isFalse();
    }

    @Test
    @DisplayName("Element referenced by an attribute is embedded as a nested document")
    void referencedElementIsEmbedded() {
        var label = node("label").with("title", "Name");
        var field = node("field").with("role", "TextField").with("titleElement", label).withChildren(node("caret"));

        var snapshot = engine.snapshot(field, 3);

        var embedded = (NodeValue) snapshot.document().attributes().get("titleElement");
        assertThat(embedded.node().id()).isEqualTo(2);
        assertThat(embedded.toPlainValue()).isEqualTo(Map.of("element2", Map.of("attributes", Map.of("title", "Name"))));
        assertThat(snapshot.document().children()).extracting(DocumentNode::id).containsExactly(3);
        assertThat(snapshot.handles().resolve(2)).contains(label);
    }

    @Test
    @DisplayName("Referenced element beyond the max depth is omitted")
    void referencedElementBeyondDepthIsOmitted() {
        var field = node("field").with("role", "TextField").with("titleElement", node("label").with("title", "Name"));

        var snapshot = engine.snapshot(field, 0);

        assertThat(snapshot.document().attributes()).doesNotContainKey("titleElement");
        assertThat(snapshot.handles().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Navigation order takes precedence over default children order")
    void navigationOrderTakesPrecedence() {
        var left = node("left").with("title", "Left");
        var right = node("right").with("title", "Right");
        var group = node("group").withChildren(left, right).withNavigationOrder(right, left);

        var snapshot = engine.snapshot(group, 1);

        assertThat(snapshot.document().children())
                .extracting(child -> child.attributes().get("title"))
                .containsExactly(new TextValue("Right"), new TextValue("Left"));
    }

    @Test
    @DisplayName("Values of unknown types are replaced with placeholders")
    void unknownTypesAreReplacedWithPlaceholders() {
        var element = node("element").with("payload", new StringBuilder("raw"));

        var attributes = engine.snapshot(element, 0).document().attributes();

        assertThat(attributes.get("payload")).isEqualTo(new UnsupportedValue("[Unsupported type: StringBuilder]"));
    }

    @Test
    @DisplayName("Failing attribute reads are skipped without breaking the snapshot")
    void failingAttributeReadsAreSkipped() {
        var element = node("element").with("title", "Stale").with("value", 3).failingOn("title");

        var attributes = engine.snapshot(element, 0).document().attributes();

        assertThat(attributes).doesNotContainKey("title");
        assertThat(attributes.get("value")).isEqualTo(new NumberValue(3));
    }

    @Test
    @DisplayName("Structural attributes and empty strings are not captured")
    void structuralAttributesAreNotCaptured() {
        var child = node("child");
        var element = node("element")
                .with("title", "")
                .with("parent", node("parent"))
                .with("children", List.of(child))
                .with("label", "Visible");

        var attributes = engine.snapshot(element, 2).document().attributes();

        assertThat(attributes.keySet()).containsExactly("label");
    }

    @Test
    @DisplayName("Supported actions are listed after the attributes")
    void actionsAreListed() {
        var element = node("element").with("title", "Save").withActions("press", "", "showMenu");

        var attributes = engine.snapshot(element, 0).document().attributes();

        assertThat(attributes.keySet()).containsExactly("title", "availableActions");
        assertThat(attributes.get("availableActions").toPlainValue()).isEqualTo(List.of("press", "showMenu"));
    }

    @Test
    @DisplayName("Negative depth is rejected")
    void negativeDepthIsRejected() {
        assertThatThrownBy(() -> engine.snapshot(application, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    @DisplayName("Every snapshot starts its IDs anew")
    void everySnapshotStartsIdsAnew() {
        var first = engine.snapshot(window, 1);
        var second = engine.snapshot(window, 1);

        assertThat(first.handles().ids()).containsExactly(1, 2, 3);
        assertThat(second.handles().ids()).containsExactly(1, 2, 3);
        assertThat(second.handles().resolve(2)).contains(button);
    }
}
