package dev.blogpulse.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Read-only view of a CMS post. Only used to validate post ids and label reports.
 */
@Table("blog_posts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlogPost {

    @Id
    private Long id;

    private String title;

    private String slug;

    private String status;
}
