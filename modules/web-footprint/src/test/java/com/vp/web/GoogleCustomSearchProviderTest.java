package com.vp.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vp.client.VpApiException;
import com.vp.client.VpClientProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleCustomSearchProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockRestServiceServer server;
    private VpClientProperties props;
    private GoogleCustomSearchProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();

        props = new VpClientProperties();
        props.setGoogleSearchBaseUrl("https://search.test/customsearch/v1");
        props.setGoogleApiKey("k");
        props.setGoogleCx("cx1");
        provider = new GoogleCustomSearchProvider(builder.build(), props);
    }

    private String page(int from, int count) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode items = root.putArray("items");
        for (int i = from; i < from + count; i++) {
            items.addObject().put("link", "https://example.org/" + i).put("title", "Result " + i);
        }
        return root.toString();
    }

    @Test
    void pagesUntilTheBudgetIsFilled() {
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
                .andExpect(queryParam("key", "k"))
                .andExpect(queryParam("cx", "cx1"))
                .andExpect(queryParam("num", "10"))
                .andExpect(queryParam("start", "1"))
                .andRespond(withSuccess(page(0, 10), MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
                .andExpect(queryParam("num", "5"))
                .andExpect(queryParam("start", "11"))
                .andRespond(withSuccess(page(10, 5), MediaType.APPLICATION_JSON));

        List<SearchHit> hits = provider.search("john smith boston ma", 15);

        assertThat(hits).hasSize(15);
        assertThat(hits.get(14).url()).isEqualTo("https://example.org/14");
        assertThat(hits.get(0).title()).isEqualTo("Result 0");
        server.verify();
    }

    @Test
    void shortPageStopsPaging() {
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
                .andRespond(withSuccess(page(0, 3), MediaType.APPLICATION_JSON));

        assertThat(provider.search("rare name", 15)).hasSize(3);
        server.verify();
    }

    @Test
    void noItemsIsEmpty() {
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
                .andRespond(withSuccess("{\"searchInformation\":{\"totalResults\":\"0\"}}", MediaType.APPLICATION_JSON));

        assertThat(provider.search("nobody", 5)).isEmpty();
    }

    @Test
    void itemsWithoutLinkAreDropped() {
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
                .andRespond(withSuccess("{\"items\":[{\"title\":\"no link\"},{\"link\":\"https://a.org\"}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(provider.search("q", 5)).extracting(SearchHit::url).containsExactly("https://a.org");
    }

    @Test
    void notConfiguredMeansEmptyWithoutACall() {
        props.setGoogleCx(null);

        assertThat(provider.search("q", 5)).isEmpty();
        server.verify();
    }

    @Test
    void quotaErrorThrows() {
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("{\"error\":{\"message\":\"Quota exceeded\"}}"));

        assertThatThrownBy(() -> provider.search("q", 5))
                .isInstanceOf(VpApiException.class)
                .hasMessageContaining("Quota exceeded");
    }
}
