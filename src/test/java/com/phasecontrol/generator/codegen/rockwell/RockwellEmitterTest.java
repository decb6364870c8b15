package com.phasecontrol.generator.codegen.rockwell;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.xml.parsers.DocumentBuilderFactory;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.phasecontrol.generator.codegen.condition.ConditionCompiler;
import com.phasecontrol.generator.codegen.config.ConfigTables;
import com.phasecontrol.generator.codegen.grouping.StepGrouper;
import com.phasecontrol.generator.codegen.model.Activation;
import com.phasecontrol.generator.codegen.model.ConditionMap;
import com.phasecontrol.generator.codegen.rule.ActivationRuleResolver;
import com.phasecontrol.generator.codegen.template.TemplateRenderer;
import com.phasecontrol.generator.codegen.util.StepNaming;
import com.phasecontrol.generator.support.TestActivations;

import static com.phasecontrol.generator.support.TestActivations.row;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RockwellEmitter: the ladder listing and the L5X export.
 */
class RockwellEmitterTest {

    private final StepGrouper grouper = new StepGrouper();
    private final RockwellEmitter emitter = new RockwellEmitter(
            new ActivationRuleResolver(ConfigTables.defaults()),
            new ConditionCompiler(),
            grouper,
            new TemplateRenderer(),
            TestActivations.FIXED_CLOCK);

    @Test
    void testLadderText() {
        String text = emitter.generateText(TestActivations.fillSequence(), TestActivations.fillConditions());

        String expected = String.join("\n",
                StepNaming.DOUBLE_RULE,
                "Ladder Logic Generated Automatically",
                "Date: 2024-03-05 14:07:09",
                StepNaming.DOUBLE_RULE,
                "",
                StepNaming.RULE,
                "Step 01 -- Idle",
                StepNaming.RULE,
                "",
                StepNaming.RULE,
                "Step 02 -- Fill",
                StepNaming.RULE,
                "BST XIC LS1 NXB XIO LS2 BND OTL XV101.activate",
                "XIC StepFlag[2].Flag OTL FIC100.fixedoutput",
                "");
        assertThat(text).isEqualTo(expected);
    }

    @Test
    void testLadderTextWithoutConditionsUsesStepFlag() {
        String text = emitter.generateText(List.of(row(7, "Drain", 7, 0, "DO7")), ConditionMap.empty());

        assertThat(text).contains("Step 07 -- Drain\n" + StepNaming.RULE + "\nXIC StepFlag[7].Flag OTL DO7.activate\n");
    }

    @Test
    void testL5xHeaderAndRungs() {
        String l5x = emitter.generateL5x(TestActivations.fillSequence(), TestActivations.fillConditions(),
                L5xTarget.defaults());

        assertThat(l5x).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n<RSLogix5000Content ");
        assertThat(l5x).contains("TargetType=\"Rung\" TargetCount=\"4\"");
        assertThat(l5x).contains("ExportDate=\"Tue Mar 05 14:07:09 2024\"");
        assertThat(l5x).contains("<Controller Use=\"Context\" Name=\"PhaseControl\">");
        assertThat(l5x).contains("<Program Use=\"Context\" Name=\"Phase01001_SEQ_DF_Master\">");
        assertThat(l5x).contains("<Routine Use=\"Context\" Name=\"CM_Valve\">");

        assertThat(l5x).contains("<Rung Use=\"Target\" Number=\"2\" Type=\"N\">\n<Comment>\n"
                + "<LocalizedComment Lang=\"en-US\">\n<![CDATA[" + StepNaming.RULE + "\nStep 01 -- Idle\n"
                + StepNaming.RULE + "]]>\n</LocalizedComment>\n</Comment>\n<Text>\n<![CDATA[NOP();]]>\n</Text>\n</Rung>\n");
        assertThat(l5x).contains("<Rung Use=\"Target\" Number=\"4\" Type=\"N\">\n<Text>\n"
                + "<![CDATA[[XIC(LS1) ,XIO(LS2) ]OTL(XV101.activate);]]>\n</Text>\n</Rung>\n");
        assertThat(l5x).contains("<Rung Use=\"Target\" Number=\"5\" Type=\"N\">\n<Text>\n"
                + "<![CDATA[XIC(StepFlag[2].Flag)OTL(FIC100.fixedoutput);]]>\n</Text>\n</Rung>\n");
        assertThat(l5x).doesNotContain("Number=\"6\"");
        assertThat(l5x).doesNotContain("XV102");
        assertThat(l5x).endsWith("</RLLContent>\n</Routine>\n</Routines>\n</Program>\n</Programs>\n</Controller>\n"
                + "</RSLogix5000Content>\n");
    }

    @Test
    void testL5xStepFlagTag() {
        String l5x = emitter.generateL5x(TestActivations.fillSequence(), TestActivations.fillConditions(),
                L5xTarget.defaults());

        assertThat(l5x).contains("<Tag Name=\"StepFlag\" TagType=\"Base\" DataType=\"PhaseControl_StepFlags\" "
                + "Dimensions=\"128\"");
        assertThat(l5x).contains("<Comment Operand=\"[1]\">\n<LocalizedComment Lang=\"en-US\">\n<![CDATA[Idle]]>");
        assertThat(l5x).contains("<Comment Operand=\"[2]\">\n<LocalizedComment Lang=\"en-US\">\n<![CDATA[Fill]]>");
        assertThat(l5x).contains("<![CDATA[[[7],[2],[2],");
        assertThat(count(l5x, "\\[2\\]")).isGreaterThanOrEqualTo(127);
        assertThat(count(l5x, "<Element Index=")).isEqualTo(128);
        assertThat(l5x).contains("<Element Index=\"[0]\">\n<Structure DataType=\"PhaseControl_StepFlags\">\n"
                + "<DataValueMember Name=\"Flag\" DataType=\"BOOL\" Value=\"1\"/>\n"
                + "<DataValueMember Name=\"FlagLE\" DataType=\"BOOL\" Value=\"1\"/>\n"
                + "<DataValueMember Name=\"FlagGE\" DataType=\"BOOL\" Value=\"1\"/>");
        assertThat(l5x).contains("<Element Index=\"[127]\">\n<Structure DataType=\"PhaseControl_StepFlags\">\n"
                + "<DataValueMember Name=\"Flag\" DataType=\"BOOL\" Value=\"0\"/>\n"
                + "<DataValueMember Name=\"FlagLE\" DataType=\"BOOL\" Value=\"1\"/>\n"
                + "<DataValueMember Name=\"FlagGE\" DataType=\"BOOL\" Value=\"0\"/>");
    }

    @Test
    void testTargetCountMatchesRungCount() {
        List<Activation> activations = List.of(
                row(0, "Idle", 0, 0, null),
                row(1, "Prepare", 0, 0, "XV1"),
                row(1, "Prepare", 14, 2, "FQ1"),
                row(1, "Prepare", 14, 4, "FQ2"),
                row(2, "Transfer", 8, 0, "FIC2"),
                row(2, "Transfer", 8, 3, "FIC3"),
                row(2, "Transfer", 6, 2, "AO2"),
                row(3, "Done", 10, 0, "COM3"));

        String l5x = emitter.generateL5x(activations, ConditionMap.empty(), L5xTarget.defaults());

        int rungs = count(l5x, "<Rung ");
        // 4 steps + XV1, FQ1, FIC2, COM3
        assertThat(rungs).isEqualTo(8);
        assertThat(l5x).contains("TargetCount=\"" + rungs + "\"");
        assertThat(emitter.countRungs(grouper.group(activations))).isEqualTo(rungs);
        assertThat(l5x).contains("Number=\"9\"").doesNotContain("Number=\"10\"");
    }

    @Test
    void testL5xIsWellFormedXml() throws Exception {
        String l5x = emitter.generateL5x(TestActivations.fillSequence(), TestActivations.fillConditions(),
                L5xTarget.builder()
                        .controllerName("Line1")
                        .programName("Mix&Fill")
                        .routineName("CM_\"A\"<1>")
                        .build());

        Document document = parse(l5x);

        assertThat(l5x).contains("<Program Use=\"Context\" Name=\"Mix&amp;Fill\">");
        assertThat(document.getDocumentElement().getAttribute("TargetCount")).isEqualTo("4");
        assertThat(document.getElementsByTagName("Rung").getLength()).isEqualTo(4);
        assertThat(((Element) document.getElementsByTagName("Controller").item(0)).getAttribute("Name"))
                .isEqualTo("Line1");
        assertThat(((Element) document.getElementsByTagName("Program").item(0)).getAttribute("Name"))
                .isEqualTo("Mix&Fill");
        assertThat(((Element) document.getElementsByTagName("Routine").item(0)).getAttribute("Name"))
                .isEqualTo("CM_\"A\"<1>");
    }

    @Test
    void testCdataTerminatorInStepNameIsSplit() throws Exception {
        String l5x = emitter.generateL5x(List.of(row(1, "Fill]]>Drain & <Rinse>", 0, 0, "XV1")),
                ConditionMap.empty(), L5xTarget.defaults());

        Document document = parse(l5x);

        Element comment = (Element) document.getElementsByTagName("Comment").item(0);
        assertThat(comment.getAttribute("Operand")).isEqualTo("[1]");
        assertThat(comment.getTextContent().strip()).isEqualTo("Fill]]>Drain & <Rinse>");
        assertThat(l5x).contains("<![CDATA[Fill]]]]><![CDATA[>Drain & <Rinse>]]>");
        assertThat(document.getElementsByTagName("Rung").getLength()).isEqualTo(2);
    }

    @Test
    void testOutputIsRepeatable() {
        List<Activation> activations = TestActivations.fillSequence();
        ConditionMap conditions = TestActivations.fillConditions();

        assertThat(emitter.generateText(activations, conditions))
                .isEqualTo(emitter.generateText(activations, conditions));
        assertThat(emitter.generateL5x(activations, conditions, L5xTarget.defaults()))
                .isEqualTo(emitter.generateL5x(activations, conditions, L5xTarget.defaults()));
    }

    private static Document parse(String xml) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    private static int count(String text, String regex) {
        Matcher matcher = Pattern.compile(regex).matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
