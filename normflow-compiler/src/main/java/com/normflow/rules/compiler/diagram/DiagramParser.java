/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.compiler.diagram;

import com.normflow.rules.api.exceptions.MalformedInputException;
import com.normflow.rules.api.model.NodeKind;
import com.normflow.rules.api.model.ProcessNode;
import com.normflow.rules.compiler.CompilerOptions;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads BPMN 2.0 markup into the full node/flow graph of its first process container.
 *
 * <p>Only direct children of the process are scanned, once. Elements are classified by
 * their local name so any namespace prefix is accepted:
 * <ul>
 *   <li>{@code startEvent} becomes an ENTRY node, {@code endEvent} an EXIT node</li>
 *   <li>{@code exclusiveGateway} becomes a DECISION node and contributes its declared
 *       {@code outgoing} flow ids, in authored order, to the {@link BranchOrderIndex}</li>
 *   <li>configured obligation element names (default {@code task}) become OBLIGATION nodes</li>
 *   <li>every other BPMN flow node becomes an OTHER node</li>
 *   <li>{@code sequenceFlow} elements become flows</li>
 * </ul>
 * Elements missing a required attribute are skipped. Diagram interchange, lanes,
 * annotations and data objects are ignored.
 */
public class DiagramParser {
    private static final Logger logger = Logger.getLogger(DiagramParser.class.getName());

    private static final String PROCESS_ELEMENT = "process";
    private static final String SEQUENCE_FLOW_ELEMENT = "sequenceFlow";
    private static final String OUTGOING_ELEMENT = "outgoing";

    private static final Set<String> OTHER_FLOW_NODES = Set.of(
            "task", "userTask", "serviceTask", "manualTask", "scriptTask", "businessRuleTask",
            "sendTask", "receiveTask", "subProcess", "adHocSubProcess", "transaction", "callActivity",
            "parallelGateway", "inclusiveGateway", "eventBasedGateway", "complexGateway",
            "intermediateCatchEvent", "intermediateThrowEvent", "boundaryEvent"
    );

    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY;

    static {
        DOCUMENT_BUILDER_FACTORY = DocumentBuilderFactory.newInstance();
        DOCUMENT_BUILDER_FACTORY.setNamespaceAware(true);
        // Disable external entity resolution to prevent XXE
        try {
            DOCUMENT_BUILDER_FACTORY.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-general-entities", false);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException e) {
            logger.log(Level.WARNING, "Failed to configure XML parser security features", e);
        }
    }

    private final Set<String> obligationElements;

    public DiagramParser() {
        this(CompilerOptions.DEFAULT_OBLIGATION_ELEMENTS);
    }

    public DiagramParser(Set<String> obligationElements) {
        this.obligationElements = Set.copyOf(obligationElements);
    }

    public DiagramArtifacts parse(Path diagramPath) throws IOException {
        try (InputStream in = Files.newInputStream(diagramPath)) {
            return parse(in);
        }
    }

    public DiagramArtifacts parse(String diagramXml) {
        if (diagramXml == null || diagramXml.isBlank()) {
            throw new MalformedInputException("Diagram markup cannot be null or empty");
        }
        return parse(new InputSource(new StringReader(diagramXml)));
    }

    public DiagramArtifacts parse(InputStream diagramStream) {
        if (diagramStream == null) {
            throw new MalformedInputException("Diagram input stream cannot be null");
        }
        return parse(new InputSource(diagramStream));
    }

    private DiagramArtifacts parse(InputSource source) {
        Document document;
        try {
            DocumentBuilder builder = DOCUMENT_BUILDER_FACTORY.newDocumentBuilder();
            document = builder.parse(source);
        } catch (ParserConfigurationException e) {
            throw new MalformedInputException("Failed to configure XML parser", e);
        } catch (SAXException e) {
            throw new MalformedInputException("Failed to parse diagram markup: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedInputException("Failed to read diagram markup", e);
        }

        Element process = findFirstProcess(document);
        if (process == null) {
            throw new MalformedInputException("No <process> element found in diagram");
        }
        return scanProcess(process);
    }

    private Element findFirstProcess(Document document) {
        NodeList candidates = document.getElementsByTagNameNS("*", PROCESS_ELEMENT);
        return candidates.getLength() > 0 ? (Element) candidates.item(0) : null;
    }

    private DiagramArtifacts scanProcess(Element process) {
        Map<String, ProcessNode> nodes = new LinkedHashMap<>();
        Map<String, DiagramFlow> flows = new LinkedHashMap<>();
        BranchOrderIndex branchOrder = new BranchOrderIndex();

        for (Node child = process.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element element = (Element) child;
            String type = localName(element);

            if (SEQUENCE_FLOW_ELEMENT.equals(type)) {
                DiagramFlow flow = readFlow(element);
                if (flow != null) {
                    flows.put(flow.id(), flow);
                }
                continue;
            }

            NodeKind kind = classify(type);
            if (kind == null) {
                continue;
            }
            String id = attribute(element, "id");
            if (id == null) {
                logger.fine("Skipping <" + type + "> without id");
                continue;
            }
            nodes.put(id, new ProcessNode(id, kind, element.getAttribute("name")));

            if (kind == NodeKind.DECISION) {
                branchOrder.declare(id, declaredOutgoing(element));
            }
        }

        Map<String, List<String>> outgoing = new LinkedHashMap<>();
        Map<String, List<String>> incoming = new LinkedHashMap<>();
        for (DiagramFlow flow : flows.values()) {
            outgoing.computeIfAbsent(flow.sourceId(), k -> new ArrayList<>()).add(flow.id());
            incoming.computeIfAbsent(flow.targetId(), k -> new ArrayList<>()).add(flow.id());
        }
        for (String nodeId : nodes.keySet()) {
            outgoing.computeIfAbsent(nodeId, k -> new ArrayList<>());
            incoming.computeIfAbsent(nodeId, k -> new ArrayList<>());
        }

        String processId = attribute(process, "id");
        logger.fine(() -> String.format("Parsed process %s: %d nodes, %d flows, %d decisions",
                processId, nodes.size(), flows.size(), branchOrder.size()));

        return new DiagramArtifacts(processId, nodes, flows, outgoing, incoming, branchOrder);
    }

    private NodeKind classify(String type) {
        if (obligationElements.contains(type)) {
            return NodeKind.OBLIGATION;
        }
        return switch (type) {
            case "startEvent" -> NodeKind.ENTRY;
            case "endEvent" -> NodeKind.EXIT;
            case "exclusiveGateway" -> NodeKind.DECISION;
            default -> OTHER_FLOW_NODES.contains(type) ? NodeKind.OTHER : null;
        };
    }

    private DiagramFlow readFlow(Element element) {
        String id = attribute(element, "id");
        String source = attribute(element, "sourceRef");
        String target = attribute(element, "targetRef");
        if (id == null || source == null || target == null) {
            logger.fine("Skipping incomplete sequenceFlow: id=" + id + ", sourceRef=" + source + ", targetRef=" + target);
            return null;
        }
        String label = element.hasAttribute("name") ? element.getAttribute("name") : null;
        return new DiagramFlow(id, source, target, label);
    }

    private List<String> declaredOutgoing(Element decision) {
        List<String> flowIds = new ArrayList<>();
        for (Node child = decision.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && OUTGOING_ELEMENT.equals(localName((Element) child))) {
                String flowId = child.getTextContent() != null ? child.getTextContent().strip() : "";
                if (!flowId.isEmpty()) {
                    flowIds.add(flowId);
                }
            }
        }
        return flowIds;
    }

    private static String attribute(Element element, String name) {
        String value = element.getAttribute(name);
        return value == null || value.isEmpty() ? null : value;
    }

    private static String localName(Element element) {
        String name = element.getLocalName();
        if (name == null || name.isEmpty()) {
            name = element.getTagName();
        }
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}
