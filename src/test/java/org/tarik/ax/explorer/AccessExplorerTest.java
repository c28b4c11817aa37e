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
package org.tarik.ax.explorer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tarik.ax.adapter.AttributeInput.TextInput;
import org.tarik.ax.adapter.FakeNode;
import org.tarik.ax.adapter.FakeNodeAdapter;
import org.tarik.ax.adapter.NodeAdapter;
import org.tarik.ax.model.DocumentNode;
import org.tarik.ax.serialization.YamlDocumentCodec;

import java.awt.*;
import java.awt.geom.Rectangle2D;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;
import static org.tarik.ax.adapter.FakeNode.node;
import static org.tarik.ax.explorer.ElementAnchor.BOTTOM_RIGHT;
import static org.tarik.ax.explorer.ElementAnchor.CENTER;
import static org.tarik.ax.model.ElementContext.*;

@ExtendWith(MockitoExtension.class)
class AccessExplorerTest {
    private static final String APPLICATION_NAME = "Ledger";

    @Mock
    private NodeAdapter<String> mockAdapter;

    private FakeNode application;
    private FakeNode window;
    private FakeNode amountField;
    private FakeNode saveButton;
    private FakeNode dialog;
    private AccessExplorer<FakeNode> explorer;

    @BeforeEach
    void setUp() {
        amountField = node("amount").with("role", "TextField").with("value", "100")
                .with("frame", new Rectangle2D.Double(10, 10, 200, 20)).settable("value");
        saveButton = node("save").with("title", "Save").with("role", "Button").withActions("press")
                .with("position", new Point(300, 400)).with("size", new Dimension(80, 30));
        window = node("window").with("title", "Ledger - Main").with("role", "Window")
                .with("frame", new Rectangle2D.Double(0, 0, 800, 600)).withChildren(amountField, saveButton);
        dialog = node("dialog").with("title", "Confirm").with("role", "Dialog");
        var menuBar = node("menu bar").with("role", "MenuBar").withChildren(node("file").with("title", "File"));
        application = node("application").with("title", APPLICATION_NAME).with("role", "Application").withChildren(window)
                .withMainWindow(window).withFocusedWindow(dialog).withMenuBar(menuBar);
        explorer = AccessExplorer.create(new FakeNodeAdapter().withApplication(APPLICATION_NAME, application), APPLICATION_NAME)
                .orElseThrow();
    }

    @Test
    @DisplayName("Explorer is created only for a running application")
    void createsExplorerOnlyForRunningApplication() {
        var adapter = new FakeNodeAdapter().withApplication(APPLICATION_NAME, application);

        assertThat(AccessExplorer.create(adapter, "Unknown")).isEmpty();
        assertThat(AccessExplorer.create(adapter, " ")).isEmpty();
        assertThat(explorer.getApplicationName()).isEqualTo(APPLICATION_NAME);
    }

    @Test
    @DisplayName("Main window snapshot is rendered as YAML and its IDs become resolvable")
    void snapshotsMainWindow() {
        var yaml = explorer.snapshotMainWindow().orElseThrow();

        var document = YamlDocumentCodec.parse(yaml).orElseThrow();
        assertThat(document).containsOnlyKeys("element1");
        assertThat(yaml).contains("title: Ledger - Main").contains("element2:").contains("element3:");
        assertThat(explorer.resolve(MAIN_WINDOW, 1)).contains(window);
        assertThat(explorer.resolve(MAIN_WINDOW, 2)).contains(amountField);
        assertThat(explorer.resolve(MAIN_WINDOW, 3)).contains(saveButton);
        assertThat(explorer.resolve(MAIN_WINDOW, 4)).isEmpty();
    }

    @Test
    @DisplayName("Each snapshot is stored under its own context")
    void snapshotsAreStoredPerContext() {
        explorer.snapshotMainWindow();
        explorer.snapshotFocusedWindow();
        explorer.snapshotMenuBar();

        assertThat(explorer.resolve(MAIN_WINDOW, 1)).contains(window);
        assertThat(explorer.resolve(FOCUSED_WINDOW, 1)).contains(dialog);
        assertThat(explorer.resolve(MENU_BAR, 2)).hasValueSatisfying(item -> assertThat(item.attribute("title")).isEqualTo("File"));
        assertThat(explorer.resolve(APPLICATION, 1)).isEmpty();
    }

    @Test
    @DisplayName("Application snapshot starts at the application itself and honors the depth")
    void snapshotsApplication() {
        var document = explorer.captureSnapshot(APPLICATION, 1).orElseThrow();

        assertThat(document.attributes()).containsKey("title");
        assertThat(document.children()).hasSize(1);
        assertThat(document.children().get(0).hasChildren()).isFalse();
        assertThat(explorer.resolve(APPLICATION, 2)).contains(window);
    }

    @Test
    @DisplayName("Query context has no root of its own")
    void queryContextHasNoRoot() {
        assertThat(explorer.snapshot(QUERY_RESULT, 2)).isEmpty();
    }

    @Test
    @DisplayName("Negative depth yields no snapshot")
    void negativeDepthYieldsNothing() {
        assertThat(explorer.snapshot(MAIN_WINDOW, -1)).isEmpty();
        assertThat(explorer.snapshotAt(15, 15, -1)).isEmpty();
        assertThat(explorer.resolve(MAIN_WINDOW, 1)).isEmpty();
    }

    @Test
    @DisplayName("Element from an earlier snapshot is captured into the query context")
    void resolvesAndSnapshotsElement() {
        explorer.snapshotMainWindow();

        var yaml = explorer.resolveAndSnapshot(MAIN_WINDOW, 3, 0).orElseThrow();

        assertThat(YamlDocumentCodec.parse(yaml)).contains(Map.of("element1", Map.of("attributes",
                Map.of("title", "Save", "role", "Button", "position", Map.of("x", 300, "y", 400),
                        "size", Map.of("width", 80, "height", 30), "availableActions", java.util.List.of("press")))));
        assertThat(explorer.resolve(QUERY_RESULT, 1)).contains(saveButton);
        assertThat(explorer.resolve(MAIN_WINDOW, 1)).contains(window);
        assertThat(explorer.resolveAndSnapshot(MAIN_WINDOW, 42, 0)).isEmpty();
    }

    @Test
    @DisplayName("Element at a screen point is captured into the query context")
    void snapshotsElementAtPoint() {
        assertThat(explorer.snapshotAt(15, 15, 1)).isPresent();
        assertThat(explorer.resolve(QUERY_RESULT, 1)).contains(amountField);

        assertThat(explorer.snapshotAt(5000, 5000, 1)).isEmpty();
    }

    @Test
    @DisplayName("Actions are dispatched to the resolved element")
    void performsAction() {
        explorer.snapshotMainWindow();

        assertThat(explorer.performAction(MAIN_WINDOW, 3, "press")).isTrue();
        assertThat(explorer.performAction(MAIN_WINDOW, 3, "delete")).isFalse();
        assertThat(explorer.performAction(MAIN_WINDOW, 99, "press")).isFalse();
        assertThat(saveButton.getPerformedActions()).containsExactly("press");
    }

    @Test
    @DisplayName("Attributes are set only where the element allows it")
    void setsAttribute() {
        explorer.snapshotMainWindow();

        assertThat(explorer.isAttributeSettable(MAIN_WINDOW, 2, "value")).isTrue();
        assertThat(explorer.isAttributeSettable(MAIN_WINDOW, 3, "value")).isFalse();
        assertThat(explorer.setAttribute(MAIN_WINDOW, 2, "value", new TextInput("250"))).isTrue();
        assertThat(explorer.setAttribute(MAIN_WINDOW, 3, "title", new TextInput("Store"))).isFalse();
        assertThat(amountField.attribute("value")).isEqualTo("250");
        assertThat(saveButton.attribute("title")).isEqualTo("Save");
    }

    @Test
    @DisplayName("Element location is derived from position and size or from the frame")
    void locatesElements() {
        explorer.snapshotMainWindow();

        assertThat(explorer.locateElement(MAIN_WINDOW, 3, CENTER)).contains(new Point(340, 415));
        assertThat(explorer.locateElement(MAIN_WINDOW, 3, BOTTOM_RIGHT)).contains(new Point(380, 430));
        assertThat(explorer.locateElement(MAIN_WINDOW, 2, CENTER)).contains(new Point(110, 20));
    }

    @Test
    @DisplayName("Closing invalidates all IDs and further snapshots")
    void closingInvalidatesEverything() {
        explorer.snapshotMainWindow();
        explorer.snapshotFocusedWindow();

        explorer.close();

        assertThat(explorer.isClosed()).isTrue();
        assertThat(explorer.resolve(MAIN_WINDOW, 1)).isEmpty();
        assertThat(explorer.resolve(FOCUSED_WINDOW, 1)).isEmpty();
        assertThat(explorer.snapshotMainWindow()).isEmpty();
        assertThat(explorer.performAction(MAIN_WINDOW, 3, "press")).isFalse();
    }

    @Test
    @DisplayName("Snapshot which can't be rendered keeps the previously stored IDs")
    void unrenderedSnapshotKeepsPreviousIds() {
        explorer.snapshotMainWindow();
        try (MockedStatic<YamlDocumentCodec> codecMockedStatic = mockStatic(YamlDocumentCodec.class)) {
            codecMockedStatic.when(() -> YamlDocumentCodec.toYaml(any(DocumentNode.class))).thenReturn(Optional.empty());

            assertThat(explorer.snapshot(MAIN_WINDOW, 0)).isEmpty();
            assertThat(explorer.resolveAndSnapshot(MAIN_WINDOW, 3, 0)).isEmpty();
        }

        assertThat(explorer.resolve(MAIN_WINDOW, 2)).contains(amountField);
        assertThat(explorer.resolve(MAIN_WINDOW, 3)).contains(saveButton);
        assertThat(explorer.resolve(QUERY_RESULT, 1)).isEmpty();
    }

    @Test
    @DisplayName("Adapter failures are reported as missing results")
    void adapterFailuresAreContained() {
        when(mockAdapter.findApplication("Broken")).thenReturn(Optional.of("broken app"));
        when(mockAdapter.mainWindow("broken app")).thenThrow(new IllegalStateException("Application is gone"));
        var brokenExplorer = AccessExplorer.create(mockAdapter, "Broken").orElseThrow();

        assertThat(brokenExplorer.snapshotMainWindow()).isEmpty();
        assertThat(brokenExplorer.resolve(MAIN_WINDOW, 1)).isEmpty();
        verify(mockAdapter).mainWindow("broken app");
    }

    @Test
    @DisplayName("Application which can't be searched for yields no explorer")
    void failingApplicationSearchYieldsNothing() {
        when(mockAdapter.findApplication(anyString())).thenThrow(new IllegalStateException("Accessibility is disabled"));

        assertThat(AccessExplorer.create(mockAdapter, "Ledger")).isEmpty();
    }
}
