package io.bdrc.catalogsync.parsing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import io.bdrc.catalogsync.model.ParsedRecord;
import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.transliteration.TransliterationDecoder;

import lombok.extern.slf4j.Slf4j;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.RiotException;
import org.apache.jena.riot.system.StreamRDFBase;
import org.apache.jena.sparql.core.Quad;

/**
 * Reads a BDRC TriG file.  Triples of every graph are kept in file order so that "first" and "last"
 * choices among labels, roles and agents follow the order of the source.
 */
@Slf4j
public class TrigRecordParser implements RecordParser {
    public static final String TRIG_EXTENSION = ".trig";

    public static final String ADM = "http://purl.bdrc.io/ontology/admin/";
    public static final String BDA = "http://purl.bdrc.io/admindata/";
    public static final String BDO = "http://purl.bdrc.io/ontology/core/";
    public static final String BDR = "http://purl.bdrc.io/resource/";
    public static final String SKOS = "http://www.w3.org/2004/02/skos/core#";

    private static final Node ADM_STATUS = NodeFactory.createURI(ADM + "status");
    private static final Node ADM_REPLACE_WITH = NodeFactory.createURI(ADM + "replaceWith");
    private static final Node STATUS_RELEASED = NodeFactory.createURI(BDA + "StatusReleased");
    private static final Node PREF_LABEL = NodeFactory.createURI(SKOS + "prefLabel");
    private static final Node ALT_LABEL = NodeFactory.createURI(SKOS + "altLabel");
    private static final Node CREATOR = NodeFactory.createURI(BDO + "creator");
    private static final Node ROLE = NodeFactory.createURI(BDO + "role");
    private static final Node AGENT = NodeFactory.createURI(BDO + "agent");

    private static final String TIBETAN_LANG = "bo";
    private static final String EWTS_LANG = "bo-x-ewts";

    static final String COMMENTATOR_ROLE = BDR + "R0ER0014";
    static final Set<String> AUTHOR_ROLES = Set.of(
        BDR + "R0ER0011",
        COMMENTATOR_ROLE,
        BDR + "R0ER0019",
        BDR + "R0ER0025");

    private final TransliterationDecoder decoder;

    public TrigRecordParser(TransliterationDecoder decoder) {
        this.decoder = decoder;
    }

    public static String idFromFileName(Path file) {
        var name = file.getFileName().toString();
        return name.endsWith(TRIG_EXTENSION) ? name.substring(0, name.length() - TRIG_EXTENSION.length()) : name;
    }

    @Override
    public ParsedRecord parse(Path file) throws RecordParseException {
        try (var in = Files.newInputStream(file)) {
            return parse(idFromFileName(file), in);
        } catch (IOException e) {
            throw new RecordParseException(file.toString(), e);
        }
    }

    public ParsedRecord parse(String id, InputStream in) throws RecordParseException {
        var triples = new OrderedTriples();
        try {
            RDFParser.create().source(in).lang(Lang.TRIG).parse(triples);
        } catch (RiotException e) {
            throw new RecordParseException(id, e);
        }

        var admin = NodeFactory.createURI(BDA + id);
        var resource = NodeFactory.createURI(BDR + id);
        var type = RecordType.fromId(id);

        var builder = ParsedRecord.builder()
            .id(id)
            .type(type)
            .released(triples.objects(admin, ADM_STATUS).contains(STATUS_RELEASED))
            .replacementId(triples.objects(admin, ADM_REPLACE_WITH).stream()
                .filter(n -> isBdrResource(n))
                .map(n -> n.getURI().substring(BDR.length()))
                .findFirst()
                .orElse(null));

        readLabels(triples, resource, builder);
        if (type == RecordType.WORK) {
            builder.authors(readAuthors(triples, resource));
        }
        var parsed = builder.build();
        log.atTrace().setMessage("Parsed {}").addArgument(parsed).log();
        return parsed;
    }

    private void readLabels(OrderedTriples triples, Node resource, ParsedRecord.ParsedRecordBuilder builder) {
        String lastTibetan = null;
        String lastEwts = null;
        for (var label : triples.objects(resource, PREF_LABEL)) {
            if (hasLanguage(label, TIBETAN_LANG)) {
                lastTibetan = label.getLiteralLexicalForm();
            } else if (hasLanguage(label, EWTS_LANG)) {
                lastEwts = label.getLiteralLexicalForm();
            }
        }
        if (lastTibetan != null) {
            builder.preferredLabel(lastTibetan);
        } else if (lastEwts != null) {
            builder.preferredLabel(decoder.decode(lastEwts));
        }

        var altLabels = triples.objects(resource, ALT_LABEL);
        altLabels.stream()
            .filter(n -> hasLanguage(n, TIBETAN_LANG))
            .forEach(n -> builder.alternateLabel(n.getLiteralLexicalForm()));
        altLabels.stream()
            .filter(n -> hasLanguage(n, EWTS_LANG))
            .forEach(n -> builder.alternateLabel(decoder.decode(n.getLiteralLexicalForm())));
    }

    private static List<String> readAuthors(OrderedTriples triples, Node resource) {
        var commentators = new ArrayList<String>();
        var all = new ArrayList<String>();
        for (var creator : triples.objects(resource, CREATOR)) {
            var role = triples.objects(creator, ROLE).stream()
                .filter(n -> n.isURI() && AUTHOR_ROLES.contains(n.getURI()))
                .map(Node::getURI)
                .findFirst();
            var agent = triples.objects(creator, AGENT).stream()
                .filter(TrigRecordParser::isBdrResource)
                .map(n -> n.getURI().substring(BDR.length()))
                .findFirst();
            if (role.isEmpty() || agent.isEmpty()) {
                continue;
            }
            all.add(agent.get());
            if (COMMENTATOR_ROLE.equals(role.get())) {
                commentators.add(agent.get());
            }
        }
        return commentators.isEmpty() ? all : commentators;
    }

    private static boolean isBdrResource(Node node) {
        return node.isURI() && node.getURI().startsWith(BDR) && node.getURI().length() > BDR.length();
    }

    private static boolean hasLanguage(Node node, String language) {
        return node.isLiteral() && language.equalsIgnoreCase(node.getLiteralLanguage());
    }

    /**
     * Collects the triples of all graphs in the order the parser emits them.
     */
    private static class OrderedTriples extends StreamRDFBase {
        private final List<Triple> triples = new ArrayList<>();

        @Override
        public void triple(Triple triple) {
            triples.add(triple);
        }

        @Override
        public void quad(Quad quad) {
            triples.add(quad.asTriple());
        }

        List<Node> objects(Node subject, Node predicate) {
            return triples.stream()
                .filter(t -> t.getSubject().equals(subject) && t.getPredicate().equals(predicate))
                .map(Triple::getObject)
                .collect(Collectors.toList());
        }
    }
}
