package com.dfisemesh.nastran;

import com.dfisemesh.Fixtures;
import com.dfisemesh.io.MaterialLibraryDocument;
import com.dfisemesh.io.MeshJson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaterialLibraryTest {

    @Test
    void listedMaterialsOverrideTheDefaults() throws Exception {
        MaterialLibrary library = MaterialLibrary.fromDocument(
                MeshJson.readMaterials(Fixtures.path("materials.json")), MaterialProperties.SILICON);

        assertThat(library.propertiesFor("Oxide")).isEqualTo(new MaterialProperties(7.0e10, 0.17, 2200.0));
        assertThat(library.propertiesFor("Aluminum")).isEqualTo(new MaterialProperties(2.1e11, 0.3, 7850.0));
    }

    @Test
    void missingDefaultsUseTheFallback() {
        MaterialLibraryDocument document = new MaterialLibraryDocument();

        MaterialLibrary library = MaterialLibrary.fromDocument(document, MaterialProperties.SILICON);

        assertThat(library.propertiesFor("Anything")).isEqualTo(MaterialProperties.SILICON);
        assertThat(library.overrides()).isEmpty();
    }

    @Test
    void nullEntryIsRejected() {
        MaterialLibraryDocument document = new MaterialLibraryDocument();
        document.materials.put("Oxide", null);

        assertThatThrownBy(() -> MaterialLibrary.fromDocument(document, MaterialProperties.DEFAULT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Oxide");
    }
}
