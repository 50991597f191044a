package com.lux032.musicpipeline.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lux032.musicpipeline.model.SlskdFile;
import com.lux032.musicpipeline.model.SlskdSearchResult;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

@ExtendWith(MockitoExtension.class)
class SlskdClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private CloseableHttpClient httpClient;

    @Test
    void shouldFilterByExtensionAndSortByBitrate() throws Exception {
        JsonNode results = mapper.readTree("{\"responses\":["
            + "{\"username\":\"alice\",\"files\":["
            + "  {\"filename\":\"A\\\\01.flac\",\"size\":100,\"bitRate\":900},"
            + "  {\"filename\":\"A\\\\01.mp3\",\"size\":50,\"bitRate\":320}]},"
            + "{\"username\":\"bob\",\"files\":["
            + "  {\"filename\":\"B\\\\01.FLAC\",\"size\":120,\"bitRate\":1411,\"bitDepth\":16},"
            + "  {\"filename\":\"B\\\\02.flac\",\"size\":80}]}"
            + "]}");
        SlskdClient client = new SlskdClient(httpClient, "http://slskd:5030/", "key", Duration.ZERO);

        SlskdSearchResult result = client.parseResults(results, "search-1", "flac");

        Assertions.assertEquals(3, result.getTotalResults());
        List<String> users = result.getResults().stream().map(SlskdFile::getUsername).collect(Collectors.toList());
        Assertions.assertEquals(List.of("bob", "alice", "bob"), users);
        SlskdFile best = result.getResults().get(0);
        Assertions.assertEquals(1411, best.getBitrate());
        Assertions.assertEquals(16, best.getBitDepth());
        Assertions.assertNull(result.getResults().get(2).getBitrate());
        Assertions.assertEquals("search-1", best.getSearchId());
    }

    @Test
    void shouldCapResultsButReportFullCount() {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode response = root.putArray("responses").addObject();
        response.put("username", "carol");
        ArrayNode files = response.putArray("files");
        for (int i = 0; i < 70; i++) {
            files.addObject().put("filename", "track" + i + ".flac").put("size", i).put("bitRate", i);
        }
        SlskdClient client = new SlskdClient(httpClient, "http://slskd:5030", null, Duration.ZERO);

        SlskdSearchResult result = client.parseResults(root, "s", "");

        Assertions.assertEquals(70, result.getTotalResults());
        Assertions.assertEquals(50, result.getResults().size());
        Assertions.assertEquals(69, result.getResults().get(0).getBitrate());
    }
}
