package com.prodyna.pac.backend.domain.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A subject area of talks. Topics form a tree through their parent reference;
 * the children side is maintained by the database and is read-only here.
 *
 * @author PAC Team
 */
@Entity
@Table(name = "topic", indexes = {
    @Index(name = "idx_topic_parent", columnList = "parent_id")
})
@NamedEntityGraph(name = Topic.DETAIL_GRAPH, attributeNodes = @NamedAttributeNode("children"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Topic implements Identifiable {

    public static final String DETAIL_GRAPH = "Topic.detail";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @NotBlank
    @Size(max = 255)
    @Column(name = "name", nullable = false)
    private String name;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "parent_id")
    private Topic parent;

    @OneToMany(mappedBy = "parent", fetch = FetchType.LAZY)
    @Builder.Default
    private Set<Topic> children = new LinkedHashSet<>();
}
