package dev.coursecrawl.course;

import dev.coursecrawl.transport.CatalogTransport;
import dev.coursecrawl.transport.RedirectCheck;
import java.net.URI;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Resolves the course-platform (CEIBA) id behind a listing link.
 *
 * <p>The listing only carries an indirect link; the platform answers it with a redirect to either
 * a login page ({@code login_test.php?csn=<id>}) or the course page ({@code /course/<id>/...}).
 * A 404 or 200 answer means the course has no platform page.
 */
@Component
public class PlatformIdResolver {

  private static final Logger log = LoggerFactory.getLogger(PlatformIdResolver.class);

  static final String LOGIN_PREFIX = "https://ceiba.ntu.edu.tw/login_test.php";
  static final String COURSE_PREFIX = "https://ceiba.ntu.edu.tw/course/";
  private static final String LOGIN_ID_PARAM = "csn";

  private final CatalogTransport transport;

  public PlatformIdResolver(CatalogTransport transport) {
    this.transport = transport;
  }

  /**
   * Follows one redirect of {@code link} and extracts the platform id from its target.
   *
   * @param link platform link of the row, or null when the row has none
   * @param row identity of the row, used in error messages
   * @return the platform id, or null when there is no link or no platform page
   * @throws ExtractionException on an unexpected status or redirect target
   */
  public @Nullable String resolve(@Nullable String link, String row) {
    if (link == null || link.isBlank()) {
      return null;
    }
    String url = link.startsWith("http://") ? "https://" + link.substring("http://".length()) : link;
    try {
      URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new ExtractionException(row, "malformed platform link " + link, e);
    }

    RedirectCheck check = transport.checkRedirect(url);
    if (check.status() == 404 || check.status() == 200) {
      log.debug("{}: platform link {} answered {}, no platform id", row, url, check.status());
      return null;
    }
    if (!check.isRedirect()) {
      throw new ExtractionException(row, "HTTP status " + check.status() + " checking " + url);
    }
    String location = check.location();
    if (location == null) {
      throw new ExtractionException(row, "redirect without Location checking " + url);
    }
    return idFromLocation(location, row);
  }

  private static String idFromLocation(String location, String row) {
    if (location.startsWith(LOGIN_PREFIX)) {
      String id =
          UriComponentsBuilder.fromUriString(location)
              .build()
              .getQueryParams()
              .getFirst(LOGIN_ID_PARAM);
      if (id == null || id.isEmpty()) {
        throw new ExtractionException(row, "platform login URL without " + LOGIN_ID_PARAM);
      }
      return id;
    }
    if (location.startsWith(COURSE_PREFIX)) {
      String rest = location.substring(COURSE_PREFIX.length());
      String id = rest.split("[/?#]", 2)[0];
      if (id.isEmpty()) {
        throw new ExtractionException(row, "platform course URL without id: " + location);
      }
      return id;
    }
    throw new ExtractionException(row, "unexpected platform URL " + location);
  }
}
