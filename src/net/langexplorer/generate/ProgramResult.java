package net.langexplorer.generate;

import com.google.common.primitives.UnsignedLongs;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import net.langexplorer.util.Encodings;
import net.langexplorer.util.features.FeatureExtractor;
import net.langexplorer.util.grammar.ProgramInstance;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * The externally visible views of one generated (possibly partial)
 * program.
 */
public class ProgramResult {

    private final String program;
    private final String graphviz;
    private final List<Long> features;
    private final List<ProgramInstance.Edge> edgeList;
    private final boolean partial;

    public ProgramResult(String program, String graphviz, List<Long> features,
                         List<ProgramInstance.Edge> edgeList,
                         boolean partial) {
        this.program = program;
        this.graphviz = graphviz;
        this.features = (features == null) ?
            Collections.<Long>emptyList() :
            Collections.unmodifiableList(features);
        this.edgeList = (edgeList == null) ? null :
            Collections.unmodifiableList(edgeList);
        this.partial = partial;
    }

    public String toString() {
        return String.format("%s@%h[program=%s,partial=%s]",
            getClass().getName(), this, getProgram(), isPartial());
    }

    public String getProgram() {
        return program;
    }

    public String getGraphviz() {
        return graphviz;
    }

    public List<Long> getFeatures() {
        return features;
    }

    public List<ProgramInstance.Edge> getEdgeList() {
        return edgeList;
    }

    public boolean isPartial() {
        return partial;
    }

    public JSONObject toJSON() {
        JSONObject ret = new JSONObject();
        ret.put("program", (program == null) ? JSONObject.NULL : program);
        ret.put("graphviz", (graphviz == null) ? JSONObject.NULL : graphviz);
        JSONArray labels = new JSONArray();
        for (Long l : features) {
            labels.put(new BigInteger(UnsignedLongs.toString(l)));
        }
        ret.put("features", labels);
        if (edgeList == null) {
            ret.put("edge_list", JSONObject.NULL);
        } else {
            JSONArray edges = new JSONArray();
            for (ProgramInstance.Edge e : edgeList) {
                edges.put(new JSONArray().put(e.getParent())
                                         .put(e.getChild()));
            }
            ret.put("edge_list", edges);
        }
        ret.put("is_partial", partial);
        return ret;
    }

    /**
     * Compute the views of tree requested by config.
     * Complete programs are rendered as their UTF-8 text, partial ones as
     * their canonical debug form.
     */
    public static ProgramResult fromProgram(ProgramInstance<?, ?> tree,
            GenerationConfig config, boolean complete) {
        String text = complete ? Encodings.fromBytes(tree.serialize()) :
            tree.toString();
        List<Long> features = config.isReturnFeatures() ?
            FeatureExtractor.extract(tree, config.getLabelExtraction()) :
            null;
        List<ProgramInstance.Edge> edges = config.isReturnEdgeLists() ?
            tree.getEdgeList() : null;
        String dot = config.isReturnGraphviz() ? tree.toGraphviz() : null;
        return new ProgramResult(text, dot, features, edges, ! complete);
    }

}
