package com.docweaver.core.graph;

import com.docweaver.core.gateway.AgentRole;
import com.docweaver.core.model.ContentBlock;
import com.docweaver.core.model.DocumentDraft;
import com.docweaver.core.model.DocumentOutline;
import com.docweaver.core.model.GenerationConfig;
import com.docweaver.core.model.ImageRef;
import com.docweaver.core.model.OutlineSection;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.ResearchFindings;
import com.docweaver.core.model.ResearchNote;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The document generation pipeline:
 * research &rarr; structure &rarr; {write, image} &rarr; assembly.
 *
 * <p>Research fans out over the configured question templates, write fans out over the
 * outline sections, and the optional image stage fans out over the sections that carry an
 * image prompt. Assembly is not a stage; the orchestrator runs it once the graph settles.
 */
public final class DocumentPipeline {

    public static final String RESEARCH = "research";
    public static final String STRUCTURE = "structure";
    public static final String WRITE = "write";
    public static final String IMAGE = "image";

    public static final List<String> DEFAULT_RESEARCH_QUESTIONS = List.of(
            "What is %s?",
            "Latest developments in %s",
            "Key statistics about %s",
            "Future trends for %s");

    private DocumentPipeline() {
    }

    /**
     * Builds the graph.
     *
     * @param researchQuestions question templates, each formatted with the topic
     * @param stageWeights      progress weight per stage name; missing stages weigh 1
     * @param assemblyWeight    progress weight of the final assembly step
     */
    public static PipelineGraph create(List<String> researchQuestions, Map<String, Double> stageWeights,
                                       double assemblyWeight) {
        List<String> questions = researchQuestions == null || researchQuestions.isEmpty()
                ? DEFAULT_RESEARCH_QUESTIONS : List.copyOf(researchQuestions);
        Map<String, Double> weights = stageWeights == null ? Map.of() : stageWeights;

        var research = StageDefinition.builder(RESEARCH, AgentRole.RESEARCH)
                .weight(weights.getOrDefault(RESEARCH, 1.0))
                .planner(task -> planResearch(task, questions))
                .merger(DocumentPipeline::mergeResearch)
                .build();

        var structure = StageDefinition.builder(STRUCTURE, AgentRole.STRUCTURE)
                .dependsOn(RESEARCH)
                .weight(weights.getOrDefault(STRUCTURE, 1.0))
                .planner(DocumentPipeline::planStructure)
                .merger(DocumentPipeline::mergeStructure)
                .build();

        var write = StageDefinition.builder(WRITE, AgentRole.WRITE)
                .dependsOn(STRUCTURE)
                .weight(weights.getOrDefault(WRITE, 1.0))
                .planner(DocumentPipeline::planWrite)
                .merger(DocumentPipeline::mergeWrite)
                .build();

        var image = StageDefinition.builder(IMAGE, AgentRole.IMAGE)
                .dependsOn(STRUCTURE)
                .optional()
                .weight(weights.getOrDefault(IMAGE, 1.0))
                .enabledWhen(GenerationConfig::includeImages)
                .planner(DocumentPipeline::planImages)
                .merger(DocumentPipeline::mergeImages)
                .build();

        return new PipelineGraph(List.of(research, structure, write, image), assemblyWeight);
    }

    public static PipelineGraph createDefault() {
        return create(DEFAULT_RESEARCH_QUESTIONS,
                Map.of(RESEARCH, 1.0, STRUCTURE, 1.0, WRITE, 3.0, IMAGE, 1.0), 1.0);
    }

    // ── research ────────────────────────────────────────────────────

    static List<PlannedUnit> planResearch(PipelineTask task, List<String> questions) {
        var units = new ArrayList<PlannedUnit>();
        for (int i = 0; i < questions.size(); i++) {
            var input = new LinkedHashMap<String, Object>();
            input.put("topic", task.topic());
            input.put("question", String.format(questions.get(i), task.topic()));
            units.add(new PlannedUnit(unitId(RESEARCH, i), i, input));
        }
        return units;
    }

    static DraftContribution mergeResearch(PipelineTask task, List<UnitSuccess> successes) {
        var notes = new ArrayList<ResearchNote>();
        for (var success : successes) {
            String question = text(success.unit().input(), "question");
            Object raw = success.response().output().get("notes");
            if (!(raw instanceof Collection<?> items)) {
                throw new IllegalStateException("Research unit " + success.unit().unitId()
                        + " returned no 'notes' list");
            }
            for (Object item : items) {
                if (item instanceof Map<?, ?> note) {
                    notes.add(new ResearchNote(question, text(note, "source"), text(note, "content"),
                            number(note, "credibility", 0.5)));
                }
            }
        }
        var findings = new ResearchFindings(notes);
        return draft -> draft.withFindings(findings);
    }

    // ── structure ───────────────────────────────────────────────────

    static List<PlannedUnit> planStructure(PipelineTask task) {
        var config = task.config();
        var input = new LinkedHashMap<String, Object>();
        input.put("topic", task.topic());
        input.put("template", config.templateKind().name().toLowerCase(Locale.ROOT));
        input.put("base_sections", config.templateKind().baseSections());
        input.put("max_sections", config.maxSections());
        input.put("include_images", config.includeImages());
        input.put("findings", findingsPayload(task.draft()));
        return List.of(new PlannedUnit(unitId(STRUCTURE, 0), 0, input));
    }

    static DraftContribution mergeStructure(PipelineTask task, List<UnitSuccess> successes) {
        if (successes.isEmpty()) {
            throw new IllegalStateException("Structure stage produced no outline");
        }
        var output = successes.get(0).response().output();
        Object raw = output.get("sections");
        if (!(raw instanceof Collection<?> items) || items.isEmpty()) {
            throw new IllegalStateException("Structure output has no 'sections' list");
        }
        int cap = task.config().maxSections();
        var sections = new ArrayList<OutlineSection>();
        for (Object item : items) {
            if (sections.size() >= cap) {
                break;
            }
            if (item instanceof Map<?, ?> section) {
                String title = text(section, "title");
                if (title == null || title.isBlank()) {
                    continue;
                }
                sections.add(new OutlineSection(sections.size(), title,
                        text(section, "brief"), text(section, "image_prompt")));
            }
        }
        if (sections.isEmpty()) {
            throw new IllegalStateException("Structure output has no titled sections");
        }
        String title = text(output, "title");
        var outline = new DocumentOutline(title == null || title.isBlank() ? task.topic() : title, sections);
        return draft -> draft.withOutline(outline);
    }

    // ── write ───────────────────────────────────────────────────────

    static List<PlannedUnit> planWrite(PipelineTask task) {
        var outline = requireOutline(task);
        var units = new ArrayList<PlannedUnit>();
        for (var section : outline.sections()) {
            var input = new LinkedHashMap<String, Object>();
            input.put("topic", task.topic());
            input.put("document_title", outline.title());
            input.put("section_index", section.index());
            input.put("section_title", section.title());
            input.put("brief", section.brief() == null ? "" : section.brief());
            input.put("template", task.config().templateKind().name().toLowerCase(Locale.ROOT));
            units.add(new PlannedUnit(unitId(WRITE, section.index()), section.index(), input));
        }
        return units;
    }

    static DraftContribution mergeWrite(PipelineTask task, List<UnitSuccess> successes) {
        var outline = requireOutline(task);
        var blocks = new ArrayList<ContentBlock>();
        for (var success : successes) {
            var section = outline.sections().get(success.unit().index());
            String body = text(success.response().output(), "content");
            if (body == null) {
                throw new IllegalStateException("Write unit " + success.unit().unitId()
                        + " returned no 'content'");
            }
            blocks.add(new ContentBlock(section.index(), section.title(), body));
        }
        return draft -> draft.withContentBlocks(blocks);
    }

    // ── image ───────────────────────────────────────────────────────

    static List<PlannedUnit> planImages(PipelineTask task) {
        var outline = requireOutline(task);
        var units = new ArrayList<PlannedUnit>();
        for (var section : outline.sections()) {
            if (!section.wantsImage()) {
                continue;
            }
            var input = new LinkedHashMap<String, Object>();
            input.put("prompt", section.imagePrompt());
            input.put("style", task.config().imageStyle().wireName());
            input.put("section_index", section.index());
            units.add(new PlannedUnit(unitId(IMAGE, section.index()), section.index(), input));
        }
        return units;
    }

    static DraftContribution mergeImages(PipelineTask task, List<UnitSuccess> successes) {
        var images = new ArrayList<ImageRef>();
        for (var success : successes) {
            var output = success.response().output();
            String uri = text(output, "uri");
            if (uri == null || uri.isBlank()) {
                continue;
            }
            images.add(new ImageRef(success.unit().index(), uri, text(output, "caption")));
        }
        return draft -> draft.withImages(images);
    }

    // ── helpers ─────────────────────────────────────────────────────

    public static String unitId(String stage, int index) {
        return stage + "-" + index;
    }

    private static DocumentOutline requireOutline(PipelineTask task) {
        var outline = task.draft().outline();
        if (outline == null) {
            throw new IllegalStateException("Task " + task.id() + " has no outline yet");
        }
        return outline;
    }

    private static List<Map<String, Object>> findingsPayload(DocumentDraft draft) {
        var payload = new ArrayList<Map<String, Object>>();
        if (draft.findings() == null) {
            return payload;
        }
        for (var note : draft.findings().notes()) {
            var item = new LinkedHashMap<String, Object>();
            item.put("question", note.question());
            item.put("source", note.source());
            item.put("content", note.content());
            item.put("credibility", note.credibility());
            payload.add(item);
        }
        return payload;
    }

    private static String text(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }

    private static double number(Map<?, ?> map, String key, double fallback) {
        Object value = map.get(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
