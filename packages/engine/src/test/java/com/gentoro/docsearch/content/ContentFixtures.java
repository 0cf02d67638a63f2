package com.gentoro.docsearch.content;

import com.gentoro.docsearch.config.ContentSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes content trees in the {@code <root>/<category>/<slug>/} layout for tests. */
public final class ContentFixtures {

  public static final String SOURDOUGH_BODY =
      """
      # Sourdough Basics

      Baking bread at home starts with a healthy starter. Flour, water and patience are all the
      ingredients a beginner baker needs to produce a crusty loaf.

      ### Feeding the starter

      Feed the starter with equal weights of flour and water every day. A bubbly starter that
      doubles in size is ready for baking bread.

      ### Shaping the loaf

      Shape the dough gently, proof it overnight in the fridge and bake it in a hot dutch oven
      until the crust is deep brown.
      """;

  public static final String DRAFT_BODY =
      """
      # Unfinished Thoughts

      These notes about gardening tomatoes and watering basil are not ready yet. They describe
      compost, seedlings and the best time of year to plant vegetables in the garden.
      """;

  public static final String KUBERNETES_BODY =
      """
      # Kubernetes Autoscaling

      Kubernetes autoscaling adjusts the number of pods and nodes in a cluster to match demand.
      The horizontal pod autoscaler watches cpu metrics and scales deployments.

      ### Cluster autoscaler

      The cluster autoscaler adds nodes when pods cannot be scheduled and removes idle nodes
      from the kubernetes cluster to save cost.
      """;

  private ContentFixtures() {}

  public static ContentSettings settings(Path root) {
    return ContentSettings.defaults().withRoot(root);
  }

  /** Two published documents (one per category) and one blog draft. */
  public static void writeStandardCorpus(Path root) throws IOException {
    writeDocument(root, "blog", "sourdough-basics", "Sourdough Basics", "published", SOURDOUGH_BODY);
    writeDocument(
        root, "blog", "unfinished-thoughts", "Unfinished Thoughts", "draft", DRAFT_BODY);
    writeDocument(
        root,
        "engineering",
        "kubernetes-autoscaling",
        "Kubernetes Autoscaling",
        "published",
        KUBERNETES_BODY);
  }

  public static Path writeDocument(
      Path root, String category, String slug, String title, String status, String body)
      throws IOException {
    return writeDocument(root, category, slug, metadata(category, slug, title, status), body);
  }

  public static Path writeDocument(
      Path root, String category, String slug, String metadataYaml, String body)
      throws IOException {
    Path dir = root.resolve(category).resolve(slug);
    Files.createDirectories(dir);
    Files.writeString(dir.resolve("metadata.yaml"), metadataYaml);
    Files.writeString(dir.resolve("body.md"), body);
    return dir;
  }

  public static String metadata(String category, String slug, String title, String status) {
    return """
        title: "%s"
        slug: %s
        author: Test Author
        author_url: https://example.com/authors/test
        publish_date: "2024-01-15"
        last_modified: "2024-01-20"
        category: %s
        tags:
          - testing
          - %s
        description: Description of %s
        excerpt: Excerpt of %s
        reading_time: 3
        word_count: 450
        featured: false
        status: %s
        seo:
          meta_title: %s
        content:
          difficulty_level: intermediate
          has_code: true
          related_posts:
            - other-post
        """
        .formatted(title, slug, category, category, title, title, status, slug);
  }
}
