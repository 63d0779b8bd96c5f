package mta.nzb.checker.support;

import java.nio.charset.StandardCharsets;

/**
 * NZB documents for tests. Segment i of a generated post has message-id {@code <seg{i}@test>}.
 */
public final class NzbFixtures {

    private NzbFixtures() {}

    public static String segmentId(int index) {
        return "<seg" + index + "@test>";
    }

    public static byte[] singleFile(String subject, int segments) {
        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<nzb>\n");
        appendFile(xml, subject, 0, segments);
        xml.append("</nzb>");
        return xml.toString().getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] xml(String body) {
        return ("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" + body).getBytes(StandardCharsets.UTF_8);
    }

    private static void appendFile(StringBuilder xml, String subject, int firstIndex, int segments) {
        xml.append("  <file poster=\"poster@example\" date=\"1700000000\" subject=\"")
                .append(subject.replace("&", "&amp;").replace("\"", "&quot;"))
                .append("\">\n");
        xml.append("    <groups><group>alt.binaries.test</group></groups>\n");
        xml.append("    <segments>\n");
        for (int i = firstIndex; i < firstIndex + segments; i++) {
            xml.append("      <segment bytes=\"750000\" number=\"").append(i - firstIndex + 1).append("\">")
                    .append("&lt;seg").append(i).append("@test&gt;")
                    .append("</segment>\n");
        }
        xml.append("    </segments>\n  </file>\n");
    }
}
