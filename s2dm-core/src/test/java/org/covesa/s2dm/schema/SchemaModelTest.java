package org.covesa.s2dm.schema;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

import org.covesa.s2dm.DuplicateDefinitionException;

public class SchemaModelTest {

    @Test
    public void testRetainedTypes() {
        final TypeDefinition query = TypeDefinition.builder(TypeKind.OBJECT, "Query")
                .field("cabin", "Cabin").build();
        final TypeDefinition cabin = TypeDefinition.builder(TypeKind.OBJECT, "Cabin")
                .field("doors", "[Door]").build();
        final TypeDefinition schema = TypeDefinition.builder(TypeKind.OBJECT, "__Schema").build();
        final SchemaModel model = SchemaModel.builder().types(ImmutableList.of(query, cabin, schema))
                .rootType("Query").rootType("Mutation").build();

        Assert.assertEquals(3, model.getTypes().size());
        Assert.assertEquals(ImmutableList.of(cabin), model.getRetainedTypes());
        Assert.assertTrue(model.isExcluded("Query"));
        Assert.assertTrue(model.isExcluded("Mutation"));
        Assert.assertTrue(model.isExcluded("__Type"));
        Assert.assertFalse(model.isExcluded("Cabin"));
        Assert.assertSame(cabin, model.getType("Cabin"));
        Assert.assertNull(model.getType("Door"));
    }

    @Test
    public void testBuiltinScalars() {
        Assert.assertTrue(SchemaModel.isBuiltinScalar("ID"));
        Assert.assertFalse(SchemaModel.isBuiltinScalar("DateTime"));
    }

    @Test(expected = DuplicateDefinitionException.class)
    public void testDuplicateType() {
        SchemaModel.builder().type(TypeDefinition.builder(TypeKind.OBJECT, "Cabin").build())
                .type(TypeDefinition.builder(TypeKind.ENUM, "Cabin").build());
    }

    @Test
    public void testDuplicateField() {
        try {
            TypeDefinition.builder(TypeKind.OBJECT, "Cabin").field("doors", "[Door]")
                    .field("doors", "Int");
            Assert.fail();
        } catch (final DuplicateDefinitionException ex) {
            Assert.assertEquals("Cabin.doors", ex.getQualifiedPath());
        }
    }

    @Test(expected = DuplicateDefinitionException.class)
    public void testDuplicateEnumValue() {
        TypeDefinition.builder(TypeKind.ENUM, "CabinKindEnum").value("SUV").value("SUV");
    }

    @Test(expected = IllegalStateException.class)
    public void testFieldOnEnum() {
        TypeDefinition.builder(TypeKind.ENUM, "CabinKindEnum").field("x", "Int");
    }

    @Test
    public void testChildrenByKind() {
        final TypeDefinition union = TypeDefinition.builder(TypeKind.UNION, "Vehicle")
                .member("Car").member("Truck").member("Car").description("").build();
        Assert.assertEquals(ImmutableList.of("Car", "Truck"),
                ImmutableList.copyOf(union.getMemberTypeNames()));
        Assert.assertTrue(union.getFields().isEmpty());
        Assert.assertTrue(union.getValues().isEmpty());
        Assert.assertNull(union.getDescription());
    }

}
