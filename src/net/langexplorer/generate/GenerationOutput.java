package net.langexplorer.generate;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * The programs of a batch run, together with the options that produced
 * them.
 */
public class GenerationOutput {

    private static final Logger LOGGER = Logger.getLogger("GenerationOutput");

    public static final String PROGRAMS_FILE = "programs.json";
    public static final String GRAPHVIZ_FILE = "graphviz.json";
    public static final String GRAMMAR_FILE = "grammar.bnf";
    public static final String OPTIONS_FILE = "options.json";

    private final String grammarName;
    private final String grammar;
    private final List<ProgramResult> programs;
    private final GenerationConfig config;

    public GenerationOutput(String grammarName, String grammar,
                            List<ProgramResult> programs,
                            GenerationConfig config) {
        if (programs == null)
            throw new NullPointerException("Programs may not be null");
        if (config == null)
            throw new NullPointerException("Config may not be null");
        this.grammarName = grammarName;
        this.grammar = grammar;
        this.programs = Collections.unmodifiableList(
            new ArrayList<ProgramResult>(programs));
        this.config = config;
    }

    public String getGrammarName() {
        return grammarName;
    }

    /**
     * The BNF of the grammar, or null if it was not requested.
     */
    public String getGrammar() {
        return grammar;
    }

    public List<ProgramResult> getPrograms() {
        return programs;
    }

    /**
     * The complete (non-partial) programs only.
     */
    public List<ProgramResult> getCompletePrograms() {
        List<ProgramResult> ret = new ArrayList<ProgramResult>();
        for (ProgramResult r : programs) {
            if (! r.isPartial()) ret.add(r);
        }
        return ret;
    }

    public GenerationConfig getConfig() {
        return config;
    }

    public JSONObject toJSON() {
        JSONObject ret = new JSONObject();
        ret.put("language", (grammarName == null) ? JSONObject.NULL :
                grammarName);
        ret.put("grammar", (grammar == null) ? JSONObject.NULL : grammar);
        ret.put("programs", programsToJSON());
        ret.put("options", config.toJSON());
        return ret;
    }

    private JSONArray programsToJSON() {
        JSONArray ret = new JSONArray();
        for (ProgramResult r : programs) ret.put(r.toJSON());
        return ret;
    }

    /**
     * Write this output into dir, which is created if necessary.
     */
    public void write(File dir) throws IOException {
        if (! dir.isDirectory() && ! dir.mkdirs())
            throw new IOException("Could not create directory " + dir);
        writeFile(new File(dir, PROGRAMS_FILE), programsToJSON().toString(2));
        if (config.isReturnGraphviz()) {
            JSONArray graphs = new JSONArray();
            for (int i = 0; i < programs.size(); i++) {
                JSONObject g = new JSONObject();
                g.put("index", i);
                g.put("graphviz", programs.get(i).getGraphviz());
                graphs.put(g);
            }
            writeFile(new File(dir, GRAPHVIZ_FILE), graphs.toString(2));
        }
        if (grammar != null) writeFile(new File(dir, GRAMMAR_FILE), grammar);
        writeFile(new File(dir, OPTIONS_FILE), config.toJSON().toString(2));
        LOGGER.info("Wrote " + programs.size() + " programs to " + dir);
    }

    private static void writeFile(File path, String content)
            throws IOException {
        Writer w = new OutputStreamWriter(new FileOutputStream(path),
                                          StandardCharsets.UTF_8);
        try {
            w.write(content);
        } finally {
            w.close();
        }
    }

}
