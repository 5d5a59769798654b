import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Arrays;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yongkangl.labeling.enumeration.LabelingIterator;
import com.yongkangl.labeling.enumeration.NodeOrder;
import com.yongkangl.labeling.enumeration.TreeLabeler;
import com.yongkangl.labeling.io.PreorderSequenceParser;
import org.apache.commons.cli.*;

public class FreeTreeLabelings {
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options = new Options();
        options.addOption("t", "tree", true, "Pre-order depth sequence, e.g. 0,1,1,2 or [0,1,1,2]");
        options.addOption("f", "file", true, "File path");
        options.addOption("l", "line", true, "Line of the file holding the sequence");
        options.addOption("m", "max-label", true, "Size of the label alphabet");
        options.addOption("e", "edges", false, "Label the edges instead of the nodes");
        options.addOption("b", "balanced", false, "Index labels by the balanced traversal");
        options.addOption("c", "count", false, "Only print the number of labelings");
        options.addOption("j", "json", false, "Print the result as JSON");
        options.addOption("h", "help", false, "Print this message");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            err.println("Error parsing command line: " + e.getMessage());
            return 1;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp(new PrintWriter(out, true), HelpFormatter.DEFAULT_WIDTH,
                    "FreeTreeLabelings", null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
            return 0;
        }

        int line = 1;
        if (cmd.hasOption("line")) {
            try {
                line = Integer.parseInt(cmd.getOptionValue("line"));
            } catch (NumberFormatException e) {
                err.println("Invalid number for line");
                return 1;
            }
        }

        String inputLine = cmd.getOptionValue("tree");
        if (cmd.hasOption("file")) {
            String filePath = cmd.getOptionValue("file");
            try (BufferedReader reader = new BufferedReader(new FileReader(filePath))) {
                for (int i = 0; i < line; i++) {
                    inputLine = reader.readLine();
                    if (inputLine == null)
                        break;
                }
            } catch (IOException e) {
                err.println("Error reading file: " + e.getMessage());
                return 1;
            }
        }
        if (inputLine == null) {
            err.println("No tree given, use --tree or --file");
            return 1;
        }

        TreeLabeler labeler;
        try {
            int[] sequence = new PreorderSequenceParser(inputLine).parse();
            int maxLabel = cmd.hasOption("max-label")
                    ? PreorderSequenceParser.parseAlphabetSize(cmd.getOptionValue("max-label"))
                    : TreeLabeler.DEFAULT_MAX_LABEL;
            NodeOrder order = cmd.hasOption("balanced") ? NodeOrder.BALANCED : NodeOrder.ORIGINAL;
            labeler = new TreeLabeler(sequence, maxLabel, cmd.hasOption("edges"), order);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        }

        boolean countOnly = cmd.hasOption("count");
        LabelingIterator labelings = labeler.iterator();
        if (cmd.hasOption("json")) {
            ObjectMapper mapper = new ObjectMapper();
            ObjectNode result = mapper.createObjectNode();
            JsonNode sequence = mapper.valueToTree(labeler.getSequence());
            JsonNode balanced = mapper.valueToTree(labeler.getBalancedSequence());
            result.set("sequence", sequence);
            result.set("balanced", balanced);
            ArrayNode array = countOnly ? null : result.putArray("labelings");
            while (labelings.hasNext()) {
                int[] labeling = labelings.next();
                if (array != null) {
                    JsonNode node = mapper.valueToTree(labeling);
                    array.add(node);
                }
            }
            result.put("count", labelings.getCount());
            try {
                out.println(mapper.writeValueAsString(result));
            } catch (JsonProcessingException e) {
                err.println("Error writing JSON: " + e.getMessage());
                return 1;
            }
            return 0;
        }

        if (!countOnly) {
            out.println(Arrays.toString(labeler.getBalancedSequence()));
            out.println();
        }
        while (labelings.hasNext()) {
            int[] labeling = labelings.next();
            if (!countOnly) {
                out.println(Arrays.toString(labeling));
            }
        }
        out.println("Count of possible labelings: " + labelings.getCount());
        return 0;
    }
}
