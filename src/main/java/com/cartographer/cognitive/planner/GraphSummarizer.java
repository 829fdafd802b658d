package com.cartographer.cognitive.planner;

import com.cartographer.config.OracleProperties;
import com.cartographer.crawler.NavigationGraph;
import com.cartographer.crawler.Screen;
import com.cartographer.perception.UiElement;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 把导航图压缩成给规划模型看的文本摘要
 *
 * <pre>
 * Screen: HomeScreen
 * - Role: TextView, Text: "Settings", Leads to: SettingsScreen
 * - Role: ImageButton, Text: "Search"
 * </pre>
 *
 * 只列出有文本或标签的元素；每个屏幕的元素数和摘要总长度都有上限，超出时追加截断标记。
 */
@Component
public class GraphSummarizer {

    static final String TRUNCATED_MARKER = "... (map truncated)";

    private final int maxElementsPerScreen;
    private final int maxChars;

    @Autowired
    public GraphSummarizer(OracleProperties oracleProperties) {
        this(oracleProperties.getSummaryMaxElementsPerScreen(), oracleProperties.getSummaryMaxChars());
    }

    GraphSummarizer(int maxElementsPerScreen, int maxChars) {
        this.maxElementsPerScreen = maxElementsPerScreen;
        this.maxChars = maxChars;
    }

    public String summarize(NavigationGraph graph) {
        if (graph == null || graph.isEmpty()) {
            return "(no screens explored yet)";
        }

        StringBuilder sb = new StringBuilder();
        for (Screen screen : graph.screens()) {
            StringBuilder block = new StringBuilder();
            block.append("Screen: ").append(screen.getScreenId()).append('\n');

            List<UiElement> elements = screen.getElements();
            int listed = 0;
            for (int i = 0; i < elements.size(); i++) {
                UiElement element = elements.get(i);
                String shown = element.displayText();
                if (shown == null) {
                    continue;
                }
                if (listed == maxElementsPerScreen) {
                    block.append("- ...\n");
                    break;
                }
                block.append("- Role: ").append(element.simpleRole())
                        .append(", Text: \"").append(oneLine(shown)).append('"');
                String destination = screen.getLeadsTo().get(i);
                if (destination != null) {
                    block.append(", Leads to: ").append(destination);
                }
                block.append('\n');
                listed++;
            }

            if (sb.length() + block.length() > maxChars) {
                sb.append(TRUNCATED_MARKER).append('\n');
                break;
            }
            sb.append(block).append('\n');
        }
        return sb.toString().trim();
    }

    private static String oneLine(String text) {
        return text.replace('\n', ' ').replace("\"", "'").trim();
    }
}
