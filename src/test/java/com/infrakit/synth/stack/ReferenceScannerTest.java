package com.infrakit.synth.stack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infrakit.synth.model.SynthesizedId;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for reference discovery and rewriting in property trees.
 */
class ReferenceScannerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    @Test
    void testFindsRefsAndGetAttsInDocumentOrder() throws Exception {
        JsonNode tree = json("{'Role':{'Fn::GetAtt':['Role1','Arn']},"
                + "'Env':{'Variables':{'TABLE':{'Ref':'Table2'},'QUEUE':{'Fn::GetAtt':'Queue3.Arn'}}},"
                + "'Again':{'Ref':'Role1'}}");

        assertThat(ReferenceScanner.referencedIds(tree)).extracting(SynthesizedId::getValue)
                .containsExactly("Role1", "Table2", "Queue3");
    }

    @Test
    void testFindsReferencesNestedInJoin() throws Exception {
        JsonNode tree = json("{'Resource':{'Fn::Join':['',[{'Fn::GetAtt':['Bucket1','Arn']},'/*']]}}");

        assertThat(ReferenceScanner.referencedIds(tree)).extracting(SynthesizedId::getValue)
                .containsExactly("Bucket1");
    }

    @Test
    void testSkipsPseudoParametersAndLookalikes() throws Exception {
        JsonNode tree = json("{'Partition':{'Ref':'AWS::Partition'},"
                + "'NotARef':{'Ref':'Table1','Other':1},"
                + "'Blank':{'Ref':''}}");

        assertThat(ReferenceScanner.referencedIds(tree)).isEmpty();
    }

    @Test
    void testRewriteReplacesRenamedIdsOnly() throws Exception {
        JsonNode tree = json("{'A':{'Ref':'Table1'},'B':{'Fn::GetAtt':['Table1','Arn']},"
                + "'C':{'Fn::GetAtt':'Table1.StreamArn'},'D':{'Ref':'Queue2'}}");

        JsonNode rewritten = ReferenceScanner.rewrite(tree,
                Map.of(SynthesizedId.of("Table1"), SynthesizedId.of("Table99")));

        assertThat(rewritten.toString()).isEqualTo(json("{'A':{'Ref':'Table99'},'B':{'Fn::GetAtt':['Table99','Arn']},"
                + "'C':{'Fn::GetAtt':'Table99.StreamArn'},'D':{'Ref':'Queue2'}}").toString());
        assertThat(tree.get("A").get("Ref").asText()).isEqualTo("Table1");
    }
}
