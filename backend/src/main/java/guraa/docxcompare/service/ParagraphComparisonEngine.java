package guraa.docxcompare.service;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import guraa.docxcompare.core.TextSimilarityCalculator;
import guraa.docxcompare.core.lcs.DynamicProgrammingLcs;
import guraa.docxcompare.core.lcs.LcsMatch;
import guraa.docxcompare.exception.MalformedDocumentException;
import guraa.docxcompare.exception.UnsupportedComparisonException;
import guraa.docxcompare.model.CompareOptions;
import guraa.docxcompare.model.CompareResult;
import guraa.docxcompare.model.CompareStats;
import guraa.docxcompare.model.ComparisonEngineType;
import guraa.docxcompare.model.ReconstructionMode;
import guraa.docxcompare.reconstruction.RevisionMarkup;
import guraa.docxcompare.util.DocxPackage;
import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coarse paragraph-level comparison. Paragraphs are aligned by an LCS over their
 * normalized text, leftovers are paired by word similarity, and paired paragraphs
 * that differ get a word-token diff. Output is always rebuilt on the original package.
 */
@Slf4j
@Service
public class ParagraphComparisonEngine implements ComparisonEngine {

    /**
     * Pairs at or above this similarity are treated as unchanged.
     */
    static final double IDENTICAL_SIMILARITY = 0.9999;

    private static final Pattern TOKEN = Pattern.compile("\\s+|\\S+\\s*");

    @Override
    public ComparisonEngineType getType() {
        return ComparisonEngineType.DIFFMATCH;
    }

    @Override
    public CompareResult compare(byte[] original, byte[] revised, CompareOptions options) throws IOException {
        if (options.getReconstructionMode() == ReconstructionMode.INPLACE) {
            throw new UnsupportedComparisonException("The DIFFMATCH engine only supports REBUILD reconstruction");
        }
        Document originalXml = DocxPackage.readMainDocument(original);
        Document revisedXml = DocxPackage.readMainDocument(revised);
        Element originalBody = WmlNodes.findBody(originalXml);
        Element revisedBody = WmlNodes.findBody(revisedXml);
        if (originalBody == null || revisedBody == null) {
            throw new MalformedDocumentException("Could not find w:body in one or both documents");
        }

        List<ParagraphText> originalParagraphs = extractParagraphs(originalBody);
        List<ParagraphText> revisedParagraphs = extractParagraphs(revisedBody);
        Alignment alignment = align(originalParagraphs, revisedParagraphs, options.getDiffmatchSimilarityThreshold());

        Document output = WmlXml.copy(originalXml);
        Element body = WmlNodes.findBody(output);
        Element sectPr = null;
        List<Element> children = WmlNodes.childElements(body);
        if (!children.isEmpty() && WmlNodes.SECT_PR.equals(children.get(children.size() - 1).getTagName())) {
            sectPr = children.get(children.size() - 1);
        }
        while (body.getFirstChild() != null) {
            body.removeChild(body.getFirstChild());
        }
        RevisionMarkup markup = new RevisionMarkup(output, options.getAuthor(), options.effectiveDate());
        CompareStats stats = writeParagraphs(body, alignment, originalParagraphs, revisedParagraphs, markup);
        if (sectPr != null) {
            body.appendChild(sectPr);
        }

        log.debug("Paragraph comparison: {} original, {} revised paragraphs, {} paired",
                originalParagraphs.size(), revisedParagraphs.size(), alignment.revisedToOriginal.size());
        return CompareResult.builder()
                .document(DocxPackage.replaceMainDocument(original, output))
                .stats(stats)
                .engine(ComparisonEngineType.DIFFMATCH)
                .reconstructionModeRequested(ReconstructionMode.REBUILD)
                .reconstructionModeUsed(ReconstructionMode.REBUILD)
                .build();
    }

    /**
     * Top-level paragraphs of the body in document order, including those in table cells.
     */
    static List<ParagraphText> extractParagraphs(Element body) {
        List<ParagraphText> paragraphs = new ArrayList<>();
        for (Element paragraph : WmlNodes.findAll(body, WmlNodes.P)) {
            if (WmlNodes.hasAncestor(paragraph, WmlNodes.P)) {
                continue;
            }
            List<RunText> runs = new ArrayList<>();
            for (Element run : WmlNodes.findAll(paragraph, WmlNodes.R)) {
                if (WmlNodes.hasAncestor(run, WmlNodes.DEL, WmlNodes.MOVE_FROM)) {
                    continue;
                }
                StringBuilder text = new StringBuilder();
                for (Element child : WmlNodes.childElements(run)) {
                    String tag = child.getTagName();
                    if (WmlNodes.T.equals(tag)) {
                        text.append(child.getTextContent());
                    } else if (WmlNodes.TAB.equals(tag)) {
                        text.append('\t');
                    } else if (WmlNodes.BR.equals(tag) || WmlNodes.CR.equals(tag)) {
                        text.append('\n');
                    }
                }
                if (text.length() > 0) {
                    runs.add(new RunText(WmlNodes.findChild(run, WmlNodes.RPR), text.toString()));
                }
            }
            paragraphs.add(new ParagraphText(paragraphs.size(), paragraph, runs));
        }
        return paragraphs;
    }

    static Alignment align(List<ParagraphText> original, List<ParagraphText> revised, double similarityThreshold) {
        List<String> originalKeys = new ArrayList<>();
        for (ParagraphText paragraph : original) {
            originalKeys.add(TextSimilarityCalculator.normalize(paragraph.getText()));
        }
        List<String> revisedKeys = new ArrayList<>();
        for (ParagraphText paragraph : revised) {
            revisedKeys.add(TextSimilarityCalculator.normalize(paragraph.getText()));
        }

        Alignment alignment = new Alignment();
        List<LcsMatch> anchors = new ArrayList<>(new DynamicProgrammingLcs().compute(originalKeys, revisedKeys));
        anchors.sort(Comparator.comparingInt(LcsMatch::getOriginalIndex));
        for (LcsMatch match : anchors) {
            alignment.pair(match.getOriginalIndex(), match.getRevisedIndex(),
                    similarity(original.get(match.getOriginalIndex()), revised.get(match.getRevisedIndex())));
        }

        // Leftovers pair only within the gap between two anchors, in order on both sides.
        int originalStart = 0;
        int revisedStart = 0;
        for (int a = 0; a <= anchors.size(); a++) {
            int originalEnd = a < anchors.size() ? anchors.get(a).getOriginalIndex() : original.size();
            int revisedEnd = a < anchors.size() ? anchors.get(a).getRevisedIndex() : revised.size();
            int revisedFloor = revisedStart;
            for (int i = originalStart; i < originalEnd; i++) {
                int best = -1;
                double bestSimilarity = 0;
                for (int j = revisedFloor; j < revisedEnd; j++) {
                    double value = similarity(original.get(i), revised.get(j));
                    if (value >= similarityThreshold && (best < 0 || value > bestSimilarity)) {
                        best = j;
                        bestSimilarity = value;
                    }
                }
                if (best >= 0) {
                    alignment.pair(i, best, bestSimilarity);
                    revisedFloor = best + 1;
                }
            }
            originalStart = originalEnd + 1;
            revisedStart = revisedEnd + 1;
        }
        return alignment;
    }

    private CompareStats writeParagraphs(Element body, Alignment alignment, List<ParagraphText> original,
                                         List<ParagraphText> revised, RevisionMarkup markup) {
        Document document = markup.getDocument();
        Set<Integer> emittedOriginals = new HashSet<>();
        int insertions = 0;
        int deletions = 0;
        int modifications = 0;
        int lastOriginal = -1;
        for (ParagraphText revisedParagraph : revised) {
            Integer originalIndex = alignment.revisedToOriginal.get(revisedParagraph.getIndex());
            if (originalIndex == null) {
                body.appendChild(wholeParagraph(revisedParagraph, WmlNodes.INS, markup));
                insertions++;
                continue;
            }
            for (int i = lastOriginal + 1; i < originalIndex; i++) {
                if (!alignment.pairedOriginals.contains(i) && emittedOriginals.add(i)) {
                    body.appendChild(wholeParagraph(original.get(i), WmlNodes.DEL, markup));
                    deletions++;
                }
            }
            if (alignment.similarities.get(revisedParagraph.getIndex()) >= IDENTICAL_SIMILARITY) {
                body.appendChild(document.importNode(revisedParagraph.getElement(), true));
            } else {
                body.appendChild(diffParagraph(original.get(originalIndex), revisedParagraph, markup));
                modifications++;
            }
            lastOriginal = Math.max(lastOriginal, originalIndex);
        }
        for (int i = lastOriginal + 1; i < original.size(); i++) {
            if (!alignment.pairedOriginals.contains(i) && emittedOriginals.add(i)) {
                body.appendChild(wholeParagraph(original.get(i), WmlNodes.DEL, markup));
                deletions++;
            }
        }
        return CompareStats.builder()
                .insertions(insertions)
                .deletions(deletions)
                .modifications(modifications)
                .build();
    }

    private Element wholeParagraph(ParagraphText paragraph, String markerTag, RevisionMarkup markup) {
        Element p = newParagraph(paragraph, markup.getDocument());
        if (!paragraph.getRuns().isEmpty()) {
            Element wrapper = markup.wrapper(markerTag);
            boolean deleted = WmlNodes.DEL.equals(markerTag);
            for (RunText run : paragraph.getRuns()) {
                wrapper.appendChild(createRun(markup.getDocument(), run.getRunProperties(), run.getText(), deleted));
            }
            p.appendChild(wrapper);
        }
        markup.markParagraph(p, markerTag);
        return p;
    }

    /**
     * Word-token diff of a paired paragraph. Equal and inserted text keep the
     * formatting of the revised run they come from, deleted text that of the original run.
     */
    private Element diffParagraph(ParagraphText original, ParagraphText revised, RevisionMarkup markup) {
        List<Token> originalTokens = tokenize(original);
        List<Token> revisedTokens = tokenize(revised);
        Patch<Token> patch = DiffUtils.diff(originalTokens, revisedTokens);

        List<Piece> pieces = new ArrayList<>();
        int revisedPtr = 0;
        for (AbstractDelta<Token> delta : patch.getDeltas()) {
            int target = delta.getTarget().getPosition();
            while (revisedPtr < target) {
                pieces.add(new Piece(null, revisedTokens.get(revisedPtr++)));
            }
            for (Token token : delta.getSource().getLines()) {
                pieces.add(new Piece(WmlNodes.DEL, token));
            }
            for (Token token : delta.getTarget().getLines()) {
                pieces.add(new Piece(WmlNodes.INS, token));
            }
            revisedPtr = target + delta.getTarget().size();
        }
        while (revisedPtr < revisedTokens.size()) {
            pieces.add(new Piece(null, revisedTokens.get(revisedPtr++)));
        }

        Document document = markup.getDocument();
        Element p = newParagraph(revised, document);
        Element wrapper = null;
        int i = 0;
        while (i < pieces.size()) {
            Piece first = pieces.get(i);
            StringBuilder text = new StringBuilder();
            int j = i;
            while (j < pieces.size() && sameRun(first, pieces.get(j))) {
                text.append(pieces.get(j).token.getText());
                j++;
            }
            Element run = createRun(document, first.token.getRunProperties(), text.toString(),
                    WmlNodes.DEL.equals(first.revisionTag));
            if (first.revisionTag == null) {
                p.appendChild(run);
                wrapper = null;
            } else {
                if (wrapper == null || !wrapper.getTagName().equals(first.revisionTag)) {
                    wrapper = markup.wrapper(first.revisionTag);
                    p.appendChild(wrapper);
                }
                wrapper.appendChild(run);
            }
            i = j;
        }
        return p;
    }

    private static boolean sameRun(Piece a, Piece b) {
        return (a.revisionTag == null ? b.revisionTag == null : a.revisionTag.equals(b.revisionTag))
                && a.token.getRunProperties() == b.token.getRunProperties();
    }

    private static Element newParagraph(ParagraphText source, Document document) {
        Element p = WmlNodes.createElement(document, WmlNodes.P);
        Element pPr = WmlNodes.findChild(source.getElement(), WmlNodes.PPR);
        if (pPr != null) {
            Element copy = (Element) document.importNode(pPr, true);
            for (Element change : WmlNodes.findAll(copy, WmlNodes.PPR_CHANGE)) {
                WmlNodes.remove(change);
            }
            p.appendChild(copy);
        }
        return p;
    }

    /**
     * A run holding {@code text}, with tabs and line breaks as their own elements.
     */
    static Element createRun(Document document, Element runProperties, String text, boolean deleted) {
        Element run = WmlNodes.createElement(document, WmlNodes.R);
        if (runProperties != null) {
            Element rPr = (Element) document.importNode(runProperties, true);
            for (Element change : WmlNodes.findAll(rPr, WmlNodes.RPR_CHANGE)) {
                WmlNodes.remove(change);
            }
            run.appendChild(rPr);
        }
        StringBuilder pending = new StringBuilder();
        for (int i = 0; i <= text.length(); i++) {
            char c = i < text.length() ? text.charAt(i) : 0;
            if (i == text.length() || c == '\t' || c == '\n') {
                if (pending.length() > 0) {
                    run.appendChild(WmlNodes.createTextElement(document,
                            deleted ? WmlNodes.DEL_TEXT : WmlNodes.T, pending.toString()));
                    pending.setLength(0);
                }
                if (i < text.length()) {
                    run.appendChild(WmlNodes.createElement(document, c == '\t' ? WmlNodes.TAB : WmlNodes.BR));
                }
            } else {
                pending.append(c);
            }
        }
        return run;
    }

    static List<Token> tokenize(ParagraphText paragraph) {
        List<Token> tokens = new ArrayList<>();
        for (RunText run : paragraph.getRuns()) {
            Matcher matcher = TOKEN.matcher(run.getText());
            while (matcher.find()) {
                tokens.add(new Token(matcher.group(), run.getRunProperties()));
            }
        }
        return tokens;
    }

    private static double similarity(ParagraphText a, ParagraphText b) {
        String left = TextSimilarityCalculator.normalize(a.getText());
        String right = TextSimilarityCalculator.normalize(b.getText());
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        return TextSimilarityCalculator.calculateJaccardSimilarity(left, right, true);
    }

    @Getter
    @AllArgsConstructor
    static class RunText {
        private final Element runProperties;
        private final String text;
    }

    @Getter
    static class ParagraphText {
        private final int index;
        private final Element element;
        private final List<RunText> runs;
        private final String text;

        ParagraphText(int index, Element element, List<RunText> runs) {
            this.index = index;
            this.element = element;
            this.runs = runs;
            StringBuilder builder = new StringBuilder();
            for (RunText run : runs) {
                builder.append(run.getText());
            }
            this.text = builder.toString();
        }
    }

    /**
     * Diff token. Equality is on text only so formatting does not split tokens apart.
     */
    @Getter
    @AllArgsConstructor
    static class Token {
        private final String text;
        private final Element runProperties;

        @Override
        public boolean equals(Object o) {
            return o instanceof Token && ((Token) o).text.equals(text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }
    }

    private static class Piece {
        final String revisionTag;
        final Token token;

        Piece(String revisionTag, Token token) {
            this.revisionTag = revisionTag;
            this.token = token;
        }
    }

    static class Alignment {
        final Map<Integer, Integer> revisedToOriginal = new HashMap<>();
        final Set<Integer> pairedOriginals = new HashSet<>();
        final Map<Integer, Double> similarities = new HashMap<>();

        void pair(int originalIndex, int revisedIndex, double similarity) {
            revisedToOriginal.put(revisedIndex, originalIndex);
            pairedOriginals.add(originalIndex);
            similarities.put(revisedIndex, similarity);
        }
    }
}
